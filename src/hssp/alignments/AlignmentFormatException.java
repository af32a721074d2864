/*******************************************************************************
 * HSSPcore - Homology-derived Secondary Structure of Proteins
 * Copyright 2016 Jorge Duitama
 *
 * This file is part of HSSPcore.
 *
 *     HSSPcore is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     HSSPcore is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with HSSPcore.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package hssp.alignments;

import java.io.IOException;

/**
 * Signals that alignment data could not be interpreted: malformed Stockholm headers or data lines,
 * rows of different length, too few sequences or hit ids without the expected position suffix
 */
public class AlignmentFormatException extends IOException {

	private static final long serialVersionUID = 1L;

	public AlignmentFormatException(String message) {
		super(message);
	}

	public AlignmentFormatException(String message, Throwable cause) {
		super(message, cause);
	}
}

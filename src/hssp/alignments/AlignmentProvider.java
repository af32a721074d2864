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

import hssp.sequences.SequenceAlignment;

/**
 * Source of the multiple sequence alignments of the chains of a protein. Implementations may load
 * precomputed alignments or run an external homology search
 */
public interface AlignmentProvider {
	/**
	 * Tells if an alignment can be provided for the given chain
	 * @param chainId Id of the chain
	 * @return boolean true if getAlignment can be called for the chain
	 */
	public boolean hasAlignment(char chainId);

	/**
	 * Provides the alignment having the sequence of the given chain as query
	 * @param chainId Id of the chain
	 * @param chainSequence Amino acid sequence of the chain
	 * @return SequenceAlignment alignment with the query as first row
	 * @throws IOException If the alignment can not be obtained or it is malformed
	 */
	public SequenceAlignment getAlignment(char chainId, String chainSequence) throws IOException;
}

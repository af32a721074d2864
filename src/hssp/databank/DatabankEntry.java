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
package hssp.databank;

/**
 * Metadata of a sequence stored in a databank
 */
public class DatabankEntry {
	private final String id;
	private final String accession;
	private final String description;
	private final int length;

	public DatabankEntry(String id, String accession, String description, int length) {
		this.id = id;
		this.accession = accession;
		this.description = description;
		this.length = length;
	}
	public String getId() {
		return id;
	}
	public String getAccession() {
		return accession;
	}
	public String getDescription() {
		return description;
	}
	/**
	 * @return int length of the sequence or zero if it is not known
	 */
	public int getLength() {
		return length;
	}
}

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
package hssp.proteins;

/**
 * Residue of a protein chain with its structure numbering and its secondary structure annotation
 */
public class ChainResidue {
	private final int pdbNr;
	private final char aminoacid;
	private final String dsspFragment;

	/**
	 * @param pdbNr Number of the residue in the structure
	 * @param aminoacid One letter code of the residue
	 * @param dsspFragment Columns 6 to 39 of the DSSP line of the residue
	 */
	public ChainResidue(int pdbNr, char aminoacid, String dsspFragment) {
		this.pdbNr = pdbNr;
		this.aminoacid = aminoacid;
		this.dsspFragment = dsspFragment;
	}
	public int getPdbNr() {
		return pdbNr;
	}
	public char getAminoacid() {
		return aminoacid;
	}
	public String getDsspFragment() {
		return dsspFragment;
	}
}

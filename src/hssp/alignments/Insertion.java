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

/**
 * Run of residues present in a hit but aligned to gaps in the query. The sequence includes the hit residues
 * flanking the run on each side in lower case
 */
public class Insertion {
	private final int queryPos;
	private final int hitPos;
	private final StringBuilder sequence = new StringBuilder();

	/**
	 * Creates a new insertion
	 * @param queryPos One based position of the last query residue aligned before the insertion
	 * @param hitPos One based position in the hit of the residue preceding the insertion
	 */
	public Insertion(int queryPos, int hitPos) {
		this.queryPos = queryPos;
		this.hitPos = hitPos;
	}

	public int getQueryPos() {
		return queryPos;
	}
	public int getHitPos() {
		return hitPos;
	}
	public String getSequence() {
		return sequence.toString();
	}
	/**
	 * @return int Number of inserted residues, not counting the two flanking residues
	 */
	public int getLength() {
		return Math.max(0, sequence.length()-2);
	}
	void append(char residue) {
		sequence.append(residue);
	}
}

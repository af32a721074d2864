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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Chain of a protein with its residues in structure order
 */
public class ProteinChain {
	private final char id;
	private List<ChainResidue> residues = new ArrayList<ChainResidue>();

	public ProteinChain(char id) {
		this.id = id;
	}
	public char getId() {
		return id;
	}
	public List<ChainResidue> getResidues() {
		return Collections.unmodifiableList(residues);
	}
	public void addResidue(ChainResidue residue) {
		residues.add(residue);
	}
	public int getLength() {
		return residues.size();
	}
	/**
	 * @return String amino acid sequence of the chain
	 */
	public String getSequence() {
		StringBuilder answer = new StringBuilder(residues.size());
		for(ChainResidue r:residues) answer.append(r.getAminoacid());
		return answer.toString();
	}
}

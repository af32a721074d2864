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
 * Protein structure entry with its chains and the header lines describing it
 */
public class Protein {
	private String id;
	private List<String> descriptionLines = new ArrayList<String>();
	private List<ProteinChain> chains = new ArrayList<ProteinChain>();

	public Protein(String id) {
		this.id = id;
	}
	public String getId() {
		return id;
	}
	public void setId(String id) {
		this.id = id;
	}
	/**
	 * @return List<String> Lines such as HEADER, COMPND, SOURCE and AUTHOR formatted as they appear in the report
	 */
	public List<String> getDescriptionLines() {
		return Collections.unmodifiableList(descriptionLines);
	}
	public void addDescriptionLine(String line) {
		descriptionLines.add(line);
	}
	public List<ProteinChain> getChains() {
		return Collections.unmodifiableList(chains);
	}
	public void addChain(ProteinChain chain) {
		chains.add(chain);
	}
	public ProteinChain getChain(char chainId) {
		for(ProteinChain chain:chains) {
			if(chain.getId()==chainId) return chain;
		}
		return null;
	}
}

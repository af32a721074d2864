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
package hssp.profile;

import hssp.sequences.Aminoacids;

/**
 * Profile information of one query residue: distribution of amino acids in the aligned hits, entropy,
 * conservation and counts of deletions and insertions. Chain breaks are represented by sentinel objects
 * that only have a sequence number
 */
public class ResidueHInfo {
	public static final char CHAIN_BREAK = 0;

	private char letter;
	private char chainId;
	private String dsspFragment = "";
	private int seqNr;
	private int pdbNr;
	private int columnIndex = -1;
	private int nocc;
	private int ndel;
	private int nins;
	private double entropy;
	private double conservation;
	private int [] distribution = new int [Aminoacids.NUM_AMINOACIDS];

	/**
	 * Creates the profile of a query residue
	 * @param letter Amino acid of the query
	 * @param chainId Chain of the residue
	 * @param pdbNr Number of the residue in the structure
	 * @param columnIndex Zero based alignment column of the residue
	 */
	public ResidueHInfo(char letter, char chainId, int pdbNr, int columnIndex) {
		this.letter = letter;
		this.chainId = chainId;
		this.pdbNr = pdbNr;
		this.columnIndex = columnIndex;
		this.nocc = 1;
	}

	private ResidueHInfo(int seqNr) {
		this.letter = CHAIN_BREAK;
		this.seqNr = seqNr;
	}

	/**
	 * Creates a sentinel for a chain break
	 * @param seqNr Sequence number of the sentinel
	 * @return ResidueHInfo object without residue information
	 */
	public static ResidueHInfo createChainBreak(int seqNr) {
		return new ResidueHInfo(seqNr);
	}

	public boolean isChainBreak() {
		return letter == CHAIN_BREAK;
	}

	public char getLetter() {
		return letter;
	}
	public char getChainId() {
		return chainId;
	}
	public String getDsspFragment() {
		return dsspFragment;
	}
	public void setDsspFragment(String dsspFragment) {
		this.dsspFragment = dsspFragment!=null?dsspFragment:"";
	}
	public int getSeqNr() {
		return seqNr;
	}
	public void setSeqNr(int seqNr) {
		this.seqNr = seqNr;
	}
	public int getPdbNr() {
		return pdbNr;
	}
	public int getColumnIndex() {
		return columnIndex;
	}
	/**
	 * @return int Number of sequences with a canonical amino acid in this position, including the query
	 */
	public int getNocc() {
		return nocc;
	}
	public void setNocc(int nocc) {
		this.nocc = nocc;
	}
	public int getNdel() {
		return ndel;
	}
	public void setNdel(int ndel) {
		this.ndel = ndel;
	}
	public int getNins() {
		return nins;
	}
	public void setNins(int nins) {
		this.nins = nins;
	}
	public double getEntropy() {
		return entropy;
	}
	public void setEntropy(double entropy) {
		this.entropy = entropy;
	}
	/**
	 * @return int entropy as a percentage of the maximum entropy for 20 amino acids
	 */
	public int getRelativeEntropy() {
		return (int)Math.round(100*entropy/Math.log(Aminoacids.NUM_AMINOACIDS));
	}
	public double getConservation() {
		return conservation;
	}
	public void setConservation(double conservation) {
		this.conservation = conservation;
	}
	/**
	 * @return int variability percentage calculated from the conservation
	 */
	public int getVariability() {
		return (int)Math.round(100*(1-conservation));
	}
	/**
	 * @return int[] percentage of each amino acid in profile order
	 */
	public int[] getDistribution() {
		return distribution;
	}
	public int getPercentage(char aminoacid) {
		int idx = Aminoacids.getProfileIndex(aminoacid);
		if(idx<0) return 0;
		return distribution[idx];
	}
	public void setDistribution(int[] distribution) {
		if(distribution.length!=Aminoacids.NUM_AMINOACIDS) throw new IllegalArgumentException("Distribution must have "+Aminoacids.NUM_AMINOACIDS+" values");
		this.distribution = distribution;
	}
}

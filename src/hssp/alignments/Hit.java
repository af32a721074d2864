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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Homologous sequence aligned to the query of one protein chain with its alignment statistics.
 * Positions ifir/ilas refer to the query and jfir/jlas to the hit sequence, both one based.
 * The aligned residues are a working copy of the alignment row: columns outside the aligned span are blank
 * and residues flanking insertions are in lower case
 */
public class Hit {
	private int sourceAlignmentIndex;
	private char chainId;
	private int rank = 0;
	private String id;
	private String accession = "";
	private String description = "";
	private String pdbCode = "";
	private int ifir;
	private int ilas;
	private int jfir;
	private int jlas;
	private int lali;
	private int ngap;
	private int lgap;
	private int lseq2;
	private int identicalCount;
	private int similarCount;
	private double ide;
	private double wsim;
	private String alignedResidues;
	private List<Insertion> insertions = new ArrayList<Insertion>();

	public Hit(String id) {
		this.id = id;
	}

	public int getSourceAlignmentIndex() {
		return sourceAlignmentIndex;
	}
	public void setSourceAlignmentIndex(int sourceAlignmentIndex) {
		this.sourceAlignmentIndex = sourceAlignmentIndex;
	}
	public char getChainId() {
		return chainId;
	}
	public void setChainId(char chainId) {
		this.chainId = chainId;
	}
	/**
	 * @return int One based rank of this hit in the report or zero if the hit has not been ranked
	 */
	public int getRank() {
		return rank;
	}
	public void setRank(int rank) {
		this.rank = rank;
	}
	public String getId() {
		return id;
	}
	public void setId(String id) {
		this.id = id;
	}
	public String getAccession() {
		return accession;
	}
	public void setAccession(String accession) {
		this.accession = accession!=null?accession:"";
	}
	public String getDescription() {
		return description;
	}
	public void setDescription(String description) {
		this.description = description!=null?description:"";
	}
	public String getPdbCode() {
		return pdbCode;
	}
	public void setPdbCode(String pdbCode) {
		this.pdbCode = pdbCode!=null?pdbCode:"";
	}
	public int getIfir() {
		return ifir;
	}
	public void setIfir(int ifir) {
		this.ifir = ifir;
	}
	public int getIlas() {
		return ilas;
	}
	public void setIlas(int ilas) {
		this.ilas = ilas;
	}
	public int getJfir() {
		return jfir;
	}
	public void setJfir(int jfir) {
		this.jfir = jfir;
	}
	public int getJlas() {
		return jlas;
	}
	public void setJlas(int jlas) {
		this.jlas = jlas;
	}
	/**
	 * @return int Number of aligned residue pairs
	 */
	public int getLali() {
		return lali;
	}
	public void setLali(int lali) {
		this.lali = lali;
	}
	/**
	 * @return int Number of gap runs (deletions plus insertions)
	 */
	public int getNgap() {
		return ngap;
	}
	public void setNgap(int ngap) {
		this.ngap = ngap;
	}
	/**
	 * @return int Total number of gapped columns
	 */
	public int getLgap() {
		return lgap;
	}
	public void setLgap(int lgap) {
		this.lgap = lgap;
	}
	/**
	 * @return int Total length of the hit sequence
	 */
	public int getLseq2() {
		return lseq2;
	}
	public void setLseq2(int lseq2) {
		this.lseq2 = lseq2;
	}
	public int getIdenticalCount() {
		return identicalCount;
	}
	public void setIdenticalCount(int identicalCount) {
		this.identicalCount = identicalCount;
	}
	public int getSimilarCount() {
		return similarCount;
	}
	public void setSimilarCount(int similarCount) {
		this.similarCount = similarCount;
	}
	/**
	 * @return double Fraction of aligned pairs with identical residues
	 */
	public double getIde() {
		return ide;
	}
	public void setIde(double ide) {
		this.ide = ide;
	}
	/**
	 * @return double Fraction of aligned pairs with identical or similar residues
	 */
	public double getWsim() {
		return wsim;
	}
	public void setWsim(double wsim) {
		this.wsim = wsim;
	}
	public String getAlignedResidues() {
		return alignedResidues;
	}
	public void setAlignedResidues(String alignedResidues) {
		this.alignedResidues = alignedResidues;
	}
	/**
	 * Returns the character of the working copy of the alignment row at the given column
	 * @param column Zero based alignment column
	 * @return char residue, gap or blank if the column is outside the aligned span
	 */
	public char getAlignedResidue(int column) {
		if(alignedResidues==null || column<0 || column>=alignedResidues.length()) return ' ';
		return alignedResidues.charAt(column);
	}
	public List<Insertion> getInsertions() {
		return Collections.unmodifiableList(insertions);
	}
	public void addInsertion(Insertion insertion) {
		insertions.add(insertion);
	}
	/**
	 * Calculates identity and similarity ratios from the current counts.
	 * If no residue pairs are aligned, both ratios are zero
	 */
	public void updateRatios() {
		if(lali==0) {
			ide = 0;
			wsim = 0;
			return;
		}
		ide = (double)identicalCount/lali;
		wsim = (double)similarCount/lali;
	}
	/**
	 * @return boolean true if the identity of this hit is above the homology threshold for its aligned length
	 */
	public boolean isSignificant() {
		if(lali==0) return false;
		return HomologyThreshold.isHomologous(ide, lali);
	}
	@Override
	public String toString() {
		return id+" chain "+chainId+" ide "+ide+" lali "+lali;
	}
}

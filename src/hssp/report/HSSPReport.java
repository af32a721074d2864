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
package hssp.report;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import hssp.alignments.Hit;
import hssp.alignments.HitBuilder;
import hssp.profile.ResidueHInfo;

/**
 * Information written in an HSSP report: header metadata, ranked hits and residue profiles of every chain
 */
public class HSSPReport {
	public static final int MAX_HITS = 9999;
	public static final String DEFAULT_CONTACT = "HSSPcore";

	private String proteinId;
	private List<String> descriptionLines = new ArrayList<String>();
	private String databankVersion = "";
	private LocalDate date = LocalDate.now();
	private String contact = DEFAULT_CONTACT;
	private int seqLength = 0;
	private int nchain = 0;
	private List<Character> usedChains = new ArrayList<Character>();
	private List<Hit> hits = new ArrayList<Hit>();
	private List<ResidueHInfo> residues = new ArrayList<ResidueHInfo>();

	public HSSPReport(String proteinId) {
		this.proteinId = proteinId;
	}

	public String getProteinId() {
		return proteinId;
	}
	public void setProteinId(String proteinId) {
		this.proteinId = proteinId;
	}
	public List<String> getDescriptionLines() {
		return Collections.unmodifiableList(descriptionLines);
	}
	public void addDescriptionLine(String line) {
		descriptionLines.add(line);
	}
	public String getDatabankVersion() {
		return databankVersion;
	}
	public void setDatabankVersion(String databankVersion) {
		this.databankVersion = databankVersion!=null?databankVersion:"";
	}
	public LocalDate getDate() {
		return date;
	}
	public void setDate(LocalDate date) {
		this.date = date;
	}
	public String getContact() {
		return contact;
	}
	public void setContact(String contact) {
		this.contact = contact;
	}
	/**
	 * @return int Total number of residues of the chains used to build the report
	 */
	public int getSeqLength() {
		return seqLength;
	}
	public void setSeqLength(int seqLength) {
		this.seqLength = seqLength;
	}
	/**
	 * @return int Number of chains of the protein accepted for the report, including redundant chains
	 */
	public int getNchain() {
		return nchain;
	}
	public void setNchain(int nchain) {
		this.nchain = nchain;
	}
	public List<Character> getUsedChains() {
		return Collections.unmodifiableList(usedChains);
	}
	public int getKchain() {
		return usedChains.size();
	}
	public List<Hit> getHits() {
		return Collections.unmodifiableList(hits);
	}
	public void addHit(Hit hit) {
		hits.add(hit);
	}
	public List<ResidueHInfo> getResidues() {
		return Collections.unmodifiableList(residues);
	}

	/**
	 * Adds the results of one chain. Residues are renumbered after the residues already present and a chain break
	 * sentinel separates them from the residues of the previous chain
	 * @param chainId Id of the chain
	 * @param chainLength Number of residues of the chain
	 * @param chainHits Hits kept for the chain
	 * @param chainResidues Profiles of the residues of the chain
	 */
	public void addChainResults(char chainId, int chainLength, List<Hit> chainHits, List<ResidueHInfo> chainResidues) {
		if(!residues.isEmpty()) residues.add(ResidueHInfo.createChainBreak(residues.size()+1));
		for(ResidueHInfo info:chainResidues) {
			info.setSeqNr(residues.size()+1);
			residues.add(info);
		}
		hits.addAll(chainHits);
		usedChains.add(chainId);
		seqLength+=chainLength;
	}

	/**
	 * Sorts the hits of all chains by decreasing identity, keeps at most the given number of hits and assigns ranks
	 * @param maxHits Maximum number of hits to keep. Values larger than 9999 are reduced to 9999
	 */
	public void rankHits(int maxHits) {
		HitBuilder.rankHits(hits, Math.min(maxHits, MAX_HITS));
	}

	/**
	 * @return String Comma separated list of the chains used in the report
	 */
	public String getUsedChainsList() {
		StringBuilder answer = new StringBuilder();
		for(char c:usedChains) {
			if(answer.length()>0) answer.append(',');
			answer.append(c);
		}
		return answer.toString();
	}
}

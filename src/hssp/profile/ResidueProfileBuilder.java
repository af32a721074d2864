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

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import hssp.alignments.Hit;
import hssp.alignments.InvalidAlignmentException;
import hssp.clustering.ConservationCalculator;
import hssp.proteins.ChainResidue;
import hssp.proteins.ProteinChain;
import hssp.sequences.Aminoacids;

/**
 * Builds the profile of every residue of a chain from the alignment of the chain with its hits
 */
public class ResidueProfileBuilder {

	private Logger log = Logger.getLogger(ResidueProfileBuilder.class.getName());

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		if (log == null) throw new NullPointerException("Log can not be null");
		this.log = log;
	}

	/**
	 * Builds the profiles of the residues of the given chain. Sequence numbers start at one and a chain break
	 * sentinel is added wherever the structure numbering of consecutive residues is not contiguous
	 * @param chain Chain aligned as query
	 * @param queryRow Aligned query. Its residues must be the residues of the chain
	 * @param hits Hits kept for the chain. Their aligned residues are used to build distributions
	 * @return List<ResidueHInfo> profiles in chain order, including chain break sentinels
	 * @throws InvalidAlignmentException If the query does not match the residues of the chain
	 */
	public List<ResidueHInfo> buildProfiles(ProteinChain chain, String queryRow, List<Hit> hits) throws InvalidAlignmentException {
		List<String> rows = new ArrayList<String>(hits.size()+1);
		rows.add(queryRow);
		for(Hit hit:hits) {
			String aligned = hit.getAlignedResidues();
			if(aligned==null || aligned.length()!=queryRow.length()) throw new InvalidAlignmentException("Hit "+hit.getId()+" was not aligned to the query of chain "+chain.getId());
			rows.add(aligned);
		}
		ConservationCalculator calculator = new ConservationCalculator(rows);
		List<ChainResidue> residues = chain.getResidues();
		List<ResidueHInfo> answer = new ArrayList<ResidueHInfo>(residues.size()+1);
		int r = 0;
		for(int i=0;i<queryRow.length();i++) {
			char q = queryRow.charAt(i);
			if(Aminoacids.isGap(q)) continue;
			if(r>=residues.size()) throw new InvalidAlignmentException("Query aligned for chain "+chain.getId()+" is longer than the chain");
			ChainResidue residue = residues.get(r);
			if(Character.toUpperCase(q)!=Character.toUpperCase(residue.getAminoacid())) {
				throw new InvalidAlignmentException("Query residue "+q+" at column "+i+" does not match residue "+residue.getAminoacid()+" at position "+residue.getPdbNr()+" of chain "+chain.getId());
			}
			if(r>0 && residue.getPdbNr()>residues.get(r-1).getPdbNr()+1) {
				answer.add(ResidueHInfo.createChainBreak(answer.size()+1));
			}
			ResidueHInfo info = buildProfile(q, chain.getId(), residue.getPdbNr(), i, rows);
			info.setSeqNr(answer.size()+1);
			info.setDsspFragment(residue.getDsspFragment());
			info.setConservation(calculator.calculateConservation(i));
			answer.add(info);
			r++;
		}
		if(r!=residues.size()) throw new InvalidAlignmentException("Query aligned for chain "+chain.getId()+" has "+r+" residues but the chain has "+residues.size());
		log.info("Built profiles for "+r+" residues of chain "+chain.getId());
		return answer;
	}

	/**
	 * Builds the profile of one column
	 * @param letter Query residue
	 * @param chainId Chain of the residue
	 * @param pdbNr Structure number of the residue
	 * @param column Zero based alignment column
	 * @param rows Aligned query followed by the aligned residues of the hits
	 * @return ResidueHInfo profile without conservation and sequence number
	 */
	public ResidueHInfo buildProfile(char letter, char chainId, int pdbNr, int column, List<String> rows) {
		ResidueHInfo info = new ResidueHInfo(letter, chainId, pdbNr, column);
		int [] counts = new int [Aminoacids.NUM_AMINOACIDS];
		// Only residues counted in the distribution are occupied positions. Unknown query residues are not counted
		int nocc = 0;
		int idx = Aminoacids.getProfileIndex(letter);
		if(idx>=0) {
			counts[idx]++;
			nocc++;
		}
		String query = rows.get(0);
		boolean nextIsGap = column+1<query.length() && Aminoacids.isGap(query.charAt(column+1));
		int ndel = 0;
		int nins = 0;
		for(int j=1;j<rows.size();j++) {
			char c = rows.get(j).charAt(column);
			idx = Aminoacids.getProfileIndex(c);
			if(idx>=0) {
				counts[idx]++;
				nocc++;
			}
			if(Aminoacids.isGap(c)) ndel++;
			// Residues preceding insertions are in lower case
			if(nextIsGap && c>='a' && c<='y') nins++;
		}
		int [] distribution = new int [Aminoacids.NUM_AMINOACIDS];
		double entropy = 0;
		for(int k=0;k<counts.length && nocc>0;k++) {
			double freq = (double)counts[k]/nocc;
			distribution[k] = (int)(100*freq+0.5);
			if(freq>0) entropy -= freq*Math.log(freq);
		}
		info.setNocc(nocc);
		info.setNdel(ndel);
		info.setNins(nins);
		info.setDistribution(distribution);
		info.setEntropy(entropy);
		return info;
	}
}

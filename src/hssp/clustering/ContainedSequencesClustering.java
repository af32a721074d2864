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
package hssp.clustering;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Groups the sequences of the chains of a protein removing sequences that are fully contained in another one.
 * Each redundant sequence is assigned to the sequence containing it, which becomes its representative
 */
public class ContainedSequencesClustering {

	private Logger log = Logger.getLogger(ContainedSequencesClustering.class.getName());

	private int [] representatives;

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		if (log == null) throw new NullPointerException("Log can not be null");
		this.log = log;
	}

	/**
	 * Clusters the given sequences. Pairs are compared in nested loop order and the scan starts again
	 * after every merge until no sequence is contained in another one
	 * @param sequences Ungapped sequences to cluster
	 * @return List<Integer> Sorted indexes of the sequences that remain as representatives
	 */
	public List<Integer> cluster(List<String> sequences) {
		int n = sequences.size();
		representatives = new int [n];
		boolean [] redundant = new boolean [n];
		for(int i=0;i<n;i++) representatives[i] = i;
		boolean found = true;
		while(found) {
			found = false;
			for(int i=0;i<n-1 && !found;i++) {
				if(redundant[i]) continue;
				String a = sequences.get(i);
				for(int j=i+1;j<n && !found;j++) {
					if(redundant[j]) continue;
					String b = sequences.get(j);
					if(a.contains(b)) {
						redundant[j] = true;
						representatives[j] = i;
						found = true;
					} else if (b.contains(a)) {
						redundant[i] = true;
						representatives[i] = j;
						found = true;
					}
				}
			}
		}
		// Follow links to sequences that became redundant later
		for(int i=0;i<n;i++) {
			int r = representatives[i];
			while(representatives[r]!=r) r = representatives[r];
			representatives[i] = r;
		}
		List<Integer> answer = new ArrayList<Integer>();
		for(int i=0;i<n;i++) {
			if(!redundant[i]) answer.add(i);
		}
		Collections.sort(answer);
		log.info("Clustered "+n+" sequences into "+answer.size()+" representative sequences");
		return answer;
	}

	/**
	 * @param index Index of a clustered sequence
	 * @return int Index of the representative of the given sequence
	 */
	public int getRepresentative(int index) {
		if(representatives==null) throw new IllegalStateException("Sequences have not been clustered");
		return representatives[index];
	}

	/**
	 * @return int[] copy of the representative index of every clustered sequence
	 */
	public int [] getRepresentatives() {
		if(representatives==null) throw new IllegalStateException("Sequences have not been clustered");
		return representatives.clone();
	}
}

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

import java.util.List;

import hssp.sequences.Aminoacids;

/**
 * Symmetric matrix of weights for pairs of aligned sequences. The weight of a pair is the fraction of
 * columns with a query residue in which the two sequences do not share the same residue
 */
public class SequenceWeightMatrix {

	private int nSequences;
	private float weights[][];

	/**
	 * Calculates the weights for every pair of the given aligned rows
	 * @param rows Aligned rows. The first row is the query
	 */
	public SequenceWeightMatrix(List<String> rows) {
		if(rows.isEmpty()) throw new IllegalArgumentException("At least one row is required to calculate weights");
		nSequences = rows.size();
		String query = rows.get(0);
		int length = query.length();
		int queryResidues = 0;
		for(int k=0;k<length;k++) {
			if(!Aminoacids.isGap(query.charAt(k))) queryResidues++;
		}
		// Only the lower triangle is stored
		weights = new float [nSequences][];
		for(int i=0;i<nSequences;i++) {
			weights[i] = new float[i];
			String r1 = rows.get(i);
			if(r1.length()!=length) throw new IllegalArgumentException("Row "+i+" has length "+r1.length()+" but the query has length "+length);
			for(int j=0;j<i;j++) {
				String r2 = rows.get(j);
				int same = 0;
				for(int k=0;k<length;k++) {
					if(Aminoacids.isGap(query.charAt(k))) continue;
					if(isSameResidue(r1.charAt(k), r2.charAt(k))) same++;
				}
				weights[i][j] = queryResidues>0?1-(float)same/queryResidues:0;
			}
		}
	}

	private static boolean isSameResidue(char c1, char c2) {
		return Aminoacids.isResidue(c1) && Aminoacids.isResidue(c2) && Character.toUpperCase(c1)==Character.toUpperCase(c2);
	}

	public int getNumSequences() {
		return nSequences;
	}

	/**
	 * Returns the weight of the given pair
	 * @param i Index of the first sequence
	 * @param j Index of the second sequence. Must be different from i
	 * @return float weight between 0 and 1
	 */
	public float getWeight(int i, int j) {
		if(i==j) throw new IllegalArgumentException("Weights are not defined for a sequence with itself. Index: "+i);
		if(i<j) return weights[j][i];
		return weights[i][j];
	}
}

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
import hssp.sequences.SubstitutionMatrix;

/**
 * Calculates the conservation of alignment columns as the weighted average of the Dayhoff similarity
 * between every pair of residues in the column, normalized by the maximum similarity
 */
public class ConservationCalculator {

	private static final double MAX_SIMILARITY = 1.5;

	private final List<String> rows;
	private final SequenceWeightMatrix weights;
	private SubstitutionMatrix matrix = SubstitutionMatrix.DAYHOFF;

	/**
	 * @param rows Aligned rows. The first row is the query
	 * @param weights Weights calculated for the same rows
	 */
	public ConservationCalculator(List<String> rows, SequenceWeightMatrix weights) {
		if(rows.size()!=weights.getNumSequences()) throw new IllegalArgumentException("Weights were calculated for "+weights.getNumSequences()+" sequences but "+rows.size()+" rows were provided");
		this.rows = rows;
		this.weights = weights;
	}

	public ConservationCalculator(List<String> rows) {
		this(rows, new SequenceWeightMatrix(rows));
	}

	public SequenceWeightMatrix getWeights() {
		return weights;
	}

	public SubstitutionMatrix getMatrix() {
		return matrix;
	}
	public void setMatrix(SubstitutionMatrix matrix) {
		if (matrix == null) throw new NullPointerException("Substitution matrix can not be null");
		this.matrix = matrix;
	}

	/**
	 * Calculates the conservation of a column. Only pairs in which both residues are canonical amino acids are considered
	 * @param column Zero based alignment column
	 * @return double conservation score. 1 if no pair of canonical residues is found
	 */
	public double calculateConservation(int column) {
		double conservation = 0;
		double totalWeight = 0;
		int n = rows.size();
		for(int i=0;i<n-1;i++) {
			char ri = rows.get(i).charAt(column);
			if(!Aminoacids.isCanonical(ri)) continue;
			for(int j=i+1;j<n;j++) {
				char rj = rows.get(j).charAt(column);
				if(!Aminoacids.isCanonical(rj)) continue;
				double w = weights.getWeight(i, j);
				conservation += w*matrix.getScore(ri, rj);
				totalWeight += w*MAX_SIMILARITY;
			}
		}
		if(totalWeight==0) return 1;
		return conservation/totalWeight;
	}

}

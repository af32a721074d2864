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

import hssp.sequences.Aminoacids;
import hssp.sequences.SubstitutionMatrix;

/**
 * Hit builder for alignments that may have arbitrary gaps and mismatches at the ends, such as the alignments
 * built with clustal omega from BLAST hits. Columns are trimmed from both ends while they contain a gap in any
 * of the two sequences or a pair of residues with a non positive substitution score. Rows are expected to
 * contain the complete hit sequence
 */
public class ScoreTrimHitBuilder extends HitBuilder {

	@Override
	protected AlignedRegion findAlignedRegion(String rowId, String query, char[] row) {
		int start = 0;
		while(start<row.length && !isPositivePair(query, row, start)) start++;
		int end = row.length;
		while(end>start && !isPositivePair(query, row, end-1)) end--;
		return new AlignedRegion(start, end, 1+Aminoacids.countResidues(new String(row), 0, start));
	}

	private boolean isPositivePair(String query, char [] row, int column) {
		if(!isAlignedPair(query, row, column)) return false;
		char q = query.charAt(column);
		char s = row[column];
		SubstitutionMatrix matrix = getMatrix();
		if(!matrix.isScored(q) || !matrix.isScored(s)) return false;
		return matrix.getScore(q, s)>0;
	}
}

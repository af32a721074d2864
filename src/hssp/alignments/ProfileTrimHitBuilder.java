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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import hssp.sequences.Aminoacids;

/**
 * Hit builder for alignments produced by iterative profile searches such as jackhmmer. Row ids must have the
 * form id/start-end, where start and end are the first and last positions of the aligned domain in the hit
 * sequence. Only columns without aligned residues are trimmed at the ends
 */
public class ProfileTrimHitBuilder extends HitBuilder {

	private static final Pattern ROW_ID = Pattern.compile("(\\S+?)/(\\d+)-(\\d+)");

	@Override
	protected AlignedRegion findAlignedRegion(String rowId, String query, char[] row) throws AlignmentFormatException {
		int [] domain = parseDomain(rowId);
		int domainStart = domain[0];
		int start = 0;
		int skippedResidues = 0;
		while(start<row.length && !isAlignedPair(query, row, start)) {
			// Hit residues aligned to query gaps are not compared but they remain within the reported domain
			if(!Aminoacids.isGap(row[start])) skippedResidues++;
			start++;
		}
		int end = row.length;
		while(end>start && !isAlignedPair(query, row, end-1)) end--;
		return new AlignedRegion(start, end, domainStart+skippedResidues, domainStart, domain[1]);
	}

	@Override
	protected String getHitId(String rowId) {
		Matcher m = ROW_ID.matcher(rowId);
		if(m.matches()) return m.group(1);
		return rowId;
	}

	/**
	 * Extracts the domain limits from the given row id
	 * @param rowId Id with the form id/start-end
	 * @return int[] Array with two elements: start and end
	 * @throws AlignmentFormatException If the id does not have the expected form
	 */
	public static int [] parseDomain(String rowId) throws AlignmentFormatException {
		Matcher m = ROW_ID.matcher(rowId);
		if(!m.matches()) throw new AlignmentFormatException("Alignment id "+rowId+" should contain the aligned positions as id/start-end");
		int [] domain;
		try {
			domain = new int [] {Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3))};
		} catch (NumberFormatException e) {
			throw new AlignmentFormatException("Invalid aligned positions in alignment id "+rowId, e);
		}
		if(domain[0]<1 || domain[1]<domain[0]) throw new AlignmentFormatException("Invalid aligned positions in alignment id "+rowId);
		return domain;
	}
}

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
package hssp.sequences;

/**
 * Constants and lookups for the amino acid alphabet used to build sequence profiles.
 * Profile slots follow the historical HSSP order VLIMFWYGAPSTCHRKQEND rather than the alphabetical one
 */
public final class Aminoacids {
	/**
	 * The 20 canonical amino acids in profile order
	 */
	public static final String PROFILE_ORDER = "VLIMFWYGAPSTCHRKQEND";
	public static final int NUM_AMINOACIDS = PROFILE_ORDER.length();
	/**
	 * Characters accepted as gaps in alignments
	 */
	public static final String GAP_CHARACTERS = "-~._";
	public static final char GAP_CHARACTER = '-';

	private static final int [] PROFILE_INDEX = new int[128];
	static {
		for(int i=0;i<PROFILE_INDEX.length;i++) PROFILE_INDEX[i] = -1;
		for(int i=0;i<NUM_AMINOACIDS;i++) {
			char aa = PROFILE_ORDER.charAt(i);
			PROFILE_INDEX[aa] = i;
			PROFILE_INDEX[Character.toLowerCase(aa)] = i;
		}
	}

	private Aminoacids() {
	}

	/**
	 * Gets the profile slot of the given residue. Lower case residues map to the same slot as upper case residues
	 * @param residue Character to look for
	 * @return int Index between 0 and 19 or -1 if the character is not a canonical amino acid
	 */
	public static int getProfileIndex(char residue) {
		if(residue >= PROFILE_INDEX.length) return -1;
		return PROFILE_INDEX[residue];
	}

	public static boolean isCanonical(char residue) {
		return getProfileIndex(residue)>=0;
	}

	public static boolean isGap(char c) {
		return GAP_CHARACTERS.indexOf(c)>=0;
	}

	/**
	 * Tells if the given character is a residue letter, either canonical or not (X, B, Z, U...)
	 * @param c Character to test
	 * @return boolean true if c is an ASCII letter
	 */
	public static boolean isResidue(char c) {
		return (c>='A' && c<='Z') || (c>='a' && c<='z');
	}

	/**
	 * Counts the residues (non gap characters) within the given range
	 * @param seq Aligned sequence
	 * @param start Zero based first column (included)
	 * @param end Zero based last column (excluded)
	 * @return int number of non gap characters in the range
	 */
	public static int countResidues(CharSequence seq, int start, int end) {
		int count = 0;
		for(int i=start;i<end;i++) {
			if(isResidue(seq.charAt(i))) count++;
		}
		return count;
	}

	/**
	 * Removes the gap characters from the given aligned sequence
	 * @param aligned Sequence with gaps
	 * @return String Sequence without gaps
	 */
	public static String removeGaps(CharSequence aligned) {
		StringBuilder answer = new StringBuilder(aligned.length());
		for(int i=0;i<aligned.length();i++) {
			char c = aligned.charAt(i);
			if(!isGap(c)) answer.append(c);
		}
		return answer.toString();
	}
}

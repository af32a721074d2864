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

/**
 * Minimum identity required to consider an aligned sequence a true homolog, as a function of the aligned length.
 * Values follow the curve t(L) = 2.9015 * L^-0.562 + 0.05 for lengths between 10 and 80. Shorter lengths use the value
 * for 10 and longer lengths the value for 80
 */
public final class HomologyThreshold {
	public static final int MIN_LENGTH = 10;
	public static final int MAX_LENGTH = 80;

	private static final double [] THRESHOLDS = {
		0.845468, 0.80398,  0.767997, 0.736414, 0.708413, 0.683373, 0.660811, 0.640351, 0.621688, 0.604579,
		0.58882,  0.574246, 0.560718, 0.548117, 0.536344, 0.525314, 0.514951, 0.505194, 0.495984, 0.487275,
		0.479023, 0.471189, 0.463741, 0.456647, 0.449882, 0.44342,  0.43724,  0.431323, 0.425651, 0.420207,
		0.414976, 0.409947, 0.405105, 0.40044,  0.395941, 0.391599, 0.387406, 0.383352, 0.379431, 0.375636,
		0.37196,  0.368396, 0.364941, 0.361587, 0.358331, 0.355168, 0.352093, 0.349103, 0.346194, 0.343362,
		0.340604, 0.337917, 0.335298, 0.332744, 0.330252, 0.327821, 0.325448, 0.323129, 0.320865, 0.318652,
		0.316488, 0.314372, 0.312302, 0.310277, 0.308294, 0.306353, 0.304452, 0.302589, 0.300764, 0.298975,
		0.297221
	};

	/**
	 * Text describing the threshold curve in percentage units
	 */
	public static final String DESCRIPTION = "t(L)=(290.15 * L ** -0.562) + 5";

	private HomologyThreshold() {
	}

	/**
	 * Returns the precomputed identity threshold for the given aligned length
	 * @param alignedLength Number of aligned residue pairs
	 * @return double Minimum identity between 0 and 1
	 */
	public static double getThreshold(int alignedLength) {
		return THRESHOLDS[getTableIndex(alignedLength)];
	}

	/**
	 * Calculates the threshold from the closed form of the curve. The table returned by getThreshold
	 * is the reference used for decisions. This function is kept to verify the table
	 * @param alignedLength Number of aligned residue pairs
	 * @return double value of the curve at the clamped length
	 */
	public static double calculateThreshold(int alignedLength) {
		int l = clamp(alignedLength);
		return 2.9015 * Math.pow(l, -0.562) + 0.05;
	}

	/**
	 * Tells if an alignment with the given identity and length indicates homology
	 * @param identity Fraction of identical residues
	 * @param alignedLength Number of aligned residue pairs
	 * @return boolean true if the identity is strictly above the threshold for the given length
	 */
	public static boolean isHomologous(double identity, int alignedLength) {
		return identity > getThreshold(alignedLength);
	}

	public static int getTableIndex(int alignedLength) {
		return clamp(alignedLength) - MIN_LENGTH;
	}

	private static int clamp(int alignedLength) {
		return Math.max(MIN_LENGTH, Math.min(alignedLength, MAX_LENGTH));
	}
}

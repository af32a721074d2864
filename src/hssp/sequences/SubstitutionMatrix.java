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
 * Immutable symmetric table of scores for pairs of amino acids
 */
public class SubstitutionMatrix {

	private static final String BLOSUM62_ALPHABET = "ARNDCQEGHILKMFPSTWYVBZX*";
	private static final String [] BLOSUM62_ROWS = {
		" 4 -1 -2 -2  0 -1 -1  0 -2 -1 -1 -1 -1 -2 -1  1  0 -3 -2  0 -2 -1  0 -4",
		"-1  5  0 -2 -3  1  0 -2  0 -3 -2  2 -1 -3 -2 -1 -1 -3 -2 -3 -1  0 -1 -4",
		"-2  0  6  1 -3  0  0  0  1 -3 -3  0 -2 -3 -2  1  0 -4 -2 -3  3  0 -1 -4",
		"-2 -2  1  6 -3  0  2 -1 -1 -3 -4 -1 -3 -3 -1  0 -1 -4 -3 -3  4  1 -1 -4",
		" 0 -3 -3 -3  9 -3 -4 -3 -3 -1 -1 -3 -1 -2 -3 -1 -1 -2 -2 -1 -3 -3 -2 -4",
		"-1  1  0  0 -3  5  2 -2  0 -3 -2  1  0 -3 -1  0 -1 -2 -1 -2  0  3 -1 -4",
		"-1  0  0  2 -4  2  5 -2  0 -3 -3  1 -2 -3 -1  0 -1 -3 -2 -2  1  4 -1 -4",
		" 0 -2  0 -1 -3 -2 -2  6 -2 -4 -4 -2 -3 -3 -2  0 -2 -2 -3 -3 -1 -2 -1 -4",
		"-2  0  1 -1 -3  0  0 -2  8 -3 -3 -1 -2 -1 -2 -1 -2 -2  2 -3  0  0 -1 -4",
		"-1 -3 -3 -3 -1 -3 -3 -4 -3  4  2 -3  1  0 -3 -2 -1 -3 -1  3 -3 -3 -1 -4",
		"-1 -2 -3 -4 -1 -2 -3 -4 -3  2  4 -2  2  0 -3 -2 -1 -2 -1  1 -4 -3 -1 -4",
		"-1  2  0 -1 -3  1  1 -2 -1 -3 -2  5 -1 -3 -1  0 -1 -3 -2 -2  0  1 -1 -4",
		"-1 -1 -2 -3 -1  0 -2 -3 -2  1  2 -1  5  0 -2 -1 -1 -1 -1  1 -3 -1 -1 -4",
		"-2 -3 -3 -3 -2 -3 -3 -3 -1  0  0 -3  0  6 -4 -2 -2  1  3 -1 -3 -3 -1 -4",
		"-1 -2 -2 -1 -3 -1 -1 -2 -2 -3 -3 -1 -2 -4  7 -1 -1 -4 -3 -2 -2 -1 -2 -4",
		" 1 -1  1  0 -1  0  0  0 -1 -2 -2  0 -1 -2 -1  4  1 -3 -2 -2  0  0  0 -4",
		" 0 -1  0 -1 -1 -1 -1 -2 -2 -1 -1 -1 -1 -2 -1  1  5 -2 -2  0 -1 -1  0 -4",
		"-3 -3 -4 -4 -2 -2 -3 -2 -2 -3 -2 -3 -1  1 -4 -3 -2 11  2 -3 -4 -3 -2 -4",
		"-2 -2 -2 -3 -2 -1 -2 -3  2 -1 -1 -2 -1  3 -3 -2 -2  2  7 -1 -3 -2 -1 -4",
		" 0 -3 -3 -3 -1 -2 -2 -3 -3  3  1 -2  1 -1 -2 -2  0 -3 -1  4 -3 -2 -1 -4",
		"-2 -1  3  4 -3  0  1 -1  0 -3 -4  0 -3 -3 -2  0 -1 -4 -3 -3  4  1 -1 -4",
		"-1  0  0  1 -3  3  4 -2  0 -3 -3  1 -1 -3 -1  0 -1 -3 -2 -2  1  4 -1 -4",
		" 0 -1 -1 -1 -2 -1 -1 -1 -1 -1 -1 -1 -1 -1 -2  0  0 -2 -1 -1 -1 -1 -1 -4",
		"-4 -4 -4 -4 -4 -4 -4 -4 -4 -4 -4 -4 -4 -4 -4 -4 -4 -4 -4 -4 -4 -4 -4  1"
	};

	// Dayhoff similarities used by MAXHOM, lower triangle in profile order
	private static final double [] DAYHOFF_LOWER_TRIANGLE = {
		 1.5,
		 0.8, 1.5,
		 1.1, 0.8, 1.5,
		 0.6, 1.3, 0.6, 1.5,
		 0.2, 1.2, 0.7, 0.5, 1.5,
		-0.8, 0.5,-0.5,-0.3, 1.3, 1.5,
		-0.1, 0.3, 0.1,-0.1, 1.4, 1.1, 1.5,
		 0.2,-0.5,-0.3,-0.3,-0.6,-1.0,-0.7, 1.5,
		 0.2,-0.1, 0.0, 0.0,-0.5,-0.8,-0.3, 0.7, 1.5,
		 0.1,-0.3,-0.2,-0.2,-0.7,-0.8,-0.8, 0.3, 0.5, 1.5,
		-0.1,-0.4,-0.1,-0.3,-0.3, 0.3,-0.4, 0.6, 0.4, 0.4, 1.5,
		 0.2,-0.1, 0.2, 0.0,-0.3,-0.6,-0.3, 0.4, 0.4, 0.3, 0.3, 1.5,
		 0.2,-0.8, 0.2,-0.6,-0.1,-1.2, 1.0, 0.2, 0.3, 0.1, 0.7, 0.2, 1.5,
		-0.3,-0.2,-0.3,-0.3,-0.1,-0.1, 0.3,-0.2,-0.1, 0.2,-0.2,-0.1,-0.1, 1.5,
		-0.3,-0.4,-0.3, 0.2,-0.5, 1.4,-0.6,-0.3,-0.3, 0.3, 0.1,-0.1,-0.3, 0.5, 1.5,
		-0.2,-0.3,-0.2, 0.2,-0.7, 0.1,-0.6,-0.1, 0.0, 0.1, 0.2, 0.2,-0.6, 0.1, 0.8, 1.5,
		-0.2,-0.1,-0.3, 0.0,-0.8,-0.5,-0.6, 0.2, 0.2, 0.3,-0.1,-0.1,-0.6, 0.7, 0.4, 0.4, 1.5,
		-0.2,-0.3,-0.2,-0.2,-0.7,-1.1,-0.5, 0.5, 0.3, 0.1, 0.2, 0.2,-0.6, 0.4, 0.0, 0.3, 0.7, 1.5,
		-0.3,-0.4,-0.3,-0.3,-0.5,-0.3,-0.1, 0.4, 0.2, 0.0, 0.3, 0.2,-0.3, 0.5, 0.1, 0.4, 0.4, 0.5, 1.5,
		-0.2,-0.5,-0.2,-0.4,-1.0,-1.1,-0.5, 0.7, 0.3, 0.1, 0.2, 0.2,-0.5, 0.4, 0.0, 0.3, 0.7, 1.0, 0.7, 1.5
	};

	/**
	 * BLOSUM62 used to decide similarity between aligned residues
	 */
	public static final SubstitutionMatrix BLOSUM62 = new SubstitutionMatrix("BLOSUM62", BLOSUM62_ALPHABET, loadSquare(BLOSUM62_ROWS));
	/**
	 * Dayhoff based similarities used to calculate conservation weights. Defined only for the 20 canonical amino acids
	 */
	public static final SubstitutionMatrix DAYHOFF = new SubstitutionMatrix("DAYHOFF", Aminoacids.PROFILE_ORDER, loadLowerTriangle(DAYHOFF_LOWER_TRIANGLE, Aminoacids.NUM_AMINOACIDS));

	private final String name;
	private final String alphabet;
	private final double [][] scores;
	private final int defaultIndex;

	private SubstitutionMatrix(String name, String alphabet, double [][] scores) {
		this.name = name;
		this.alphabet = alphabet;
		this.scores = scores;
		this.defaultIndex = alphabet.indexOf('X');
	}

	public String getName() {
		return name;
	}

	public String getAlphabet() {
		return alphabet;
	}

	/**
	 * Tells if the matrix has a score for the given residue
	 * @param residue Character to test. Case is ignored
	 * @return boolean true if the residue is part of the alphabet or if the matrix has an entry for unknown residues
	 */
	public boolean isScored(char residue) {
		return getIndex(residue)>=0;
	}

	/**
	 * Returns the score for the given pair of residues. Case is ignored and residues outside the alphabet
	 * are scored as X if the matrix has an X entry
	 * @param r1 First residue
	 * @param r2 Second residue
	 * @return double score of the pair
	 * @throws IllegalArgumentException if one of the residues can not be scored by this matrix
	 */
	public double getScore(char r1, char r2) {
		int i1 = getIndex(r1);
		int i2 = getIndex(r2);
		if(i1<0) throw new IllegalArgumentException("Residue "+r1+" can not be scored with matrix "+name);
		if(i2<0) throw new IllegalArgumentException("Residue "+r2+" can not be scored with matrix "+name);
		return scores[i1][i2];
	}

	private int getIndex(char residue) {
		int idx = alphabet.indexOf(Character.toUpperCase(residue));
		if(idx<0 && Aminoacids.isResidue(residue)) return defaultIndex;
		return idx;
	}

	private static double [][] loadSquare(String [] rows) {
		double [][] answer = new double [rows.length][];
		for(int i=0;i<rows.length;i++) {
			String [] items = rows[i].trim().split("\\s+");
			if(items.length!=rows.length) throw new IllegalStateException("Row "+i+" of square matrix has "+items.length+" scores");
			answer[i] = new double[items.length];
			for(int j=0;j<items.length;j++) {
				answer[i][j] = Integer.parseInt(items[j]);
			}
		}
		return answer;
	}

	private static double [][] loadLowerTriangle(double [] values, int n) {
		if(values.length!=n*(n+1)/2) throw new IllegalStateException("Expected "+(n*(n+1)/2)+" values for lower triangle of size "+n+" but found "+values.length);
		double [][] answer = new double [n][n];
		int k = 0;
		for(int i=0;i<n;i++) {
			for(int j=0;j<=i;j++) {
				answer[i][j] = values[k];
				answer[j][i] = values[k];
				k++;
			}
		}
		return answer;
	}
}

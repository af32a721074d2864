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

import java.io.Serializable;

/**
 * Row of a multiple sequence alignment identified by a name. Residues include gap characters.
 * Identity counters are the ones accumulated while the alignment was read
 */
public class AlignedSequence implements Serializable {
	/**
	 *
	 */
	private static final long serialVersionUID = 1L;
	private final String id;
	private final String residues;
	private String description;
	private int identicalCount;
	private int alignedLength;
	private int leadingResidues = 0;
	private int trailingResidues = 0;

	public AlignedSequence(String id, String residues) {
		super();
		if(id==null) throw new NullPointerException("Aligned sequences must have an id");
		if(residues==null) throw new NullPointerException("Aligned sequence "+id+" does not have residues");
		this.id = id;
		this.residues = residues;
	}

	public AlignedSequence(String id, String residues, int identicalCount, int alignedLength) {
		this(id,residues);
		this.identicalCount = identicalCount;
		this.alignedLength = alignedLength;
	}

	public String getId() {
		return id;
	}
	public String getResidues() {
		return residues;
	}
	public int getLength() {
		return residues.length();
	}
	public char charAt(int column) {
		return residues.charAt(column);
	}
	/**
	 * @return String Residues of this row without gap characters
	 */
	public String getUngappedSequence() {
		return Aminoacids.removeGaps(residues);
	}
	public String getDescription() {
		return description;
	}
	public void setDescription(String description) {
		this.description = description;
	}
	/**
	 * @return int Number of columns in which this sequence has the same residue as the query
	 */
	public int getIdenticalCount() {
		return identicalCount;
	}
	/**
	 * @return int Number of columns in which either this sequence or the query have a residue
	 */
	public int getAlignedLength() {
		return alignedLength;
	}
	/**
	 * Identity accumulated while reading the alignment
	 * @return double identical count over aligned length or 0 if the aligned length is zero
	 */
	public double getIdentity() {
		if(alignedLength==0) return 0;
		return (double)identicalCount/alignedLength;
	}
	/**
	 * @return int Number of residues of the original row located before the first column of this row.
	 * It is larger than zero only for rows of alignments cut with {@link SequenceAlignment#subAlignment(int, int)}
	 */
	public int getLeadingResidues() {
		return leadingResidues;
	}
	public void setLeadingResidues(int leadingResidues) {
		this.leadingResidues = leadingResidues;
	}
	/**
	 * @return int Number of residues of the original row located after the last column of this row
	 */
	public int getTrailingResidues() {
		return trailingResidues;
	}
	public void setTrailingResidues(int trailingResidues) {
		this.trailingResidues = trailingResidues;
	}
	@Override
	public String toString() {
		return id+" "+residues;
	}
}

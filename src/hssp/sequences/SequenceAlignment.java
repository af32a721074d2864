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
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Multiple sequence alignment. The first row is always the query and every row has the same number of columns.
 * Rows can be looked up by index or by id
 */
public class SequenceAlignment implements Iterable<AlignedSequence>, Serializable {
	/**
	 *
	 */
	private static final long serialVersionUID = 1L;
	private final List<AlignedSequence> sequences;
	private final Map<String, Integer> sequenceIndexesMap = new HashMap<String, Integer>();

	/**
	 * Creates an alignment from the given rows
	 * @param sequences Aligned rows. The first row is taken as the query
	 * @throws IllegalArgumentException If the list is empty, if two rows have the same id or if the rows do not have the same length
	 */
	public SequenceAlignment(List<AlignedSequence> sequences) {
		if(sequences.isEmpty()) throw new IllegalArgumentException("An alignment requires at least the query sequence");
		int length = sequences.get(0).getLength();
		for(int i=0;i<sequences.size();i++) {
			AlignedSequence seq = sequences.get(i);
			if(seq.getLength()!=length) throw new IllegalArgumentException("Aligned sequence "+seq.getId()+" has length "+seq.getLength()+" but the query has length "+length);
			Integer previous = sequenceIndexesMap.put(seq.getId(), i);
			if(previous!=null) throw new IllegalArgumentException("Duplicated sequence id "+seq.getId()+" at rows "+previous+" and "+i);
		}
		this.sequences = Collections.unmodifiableList(new ArrayList<AlignedSequence>(sequences));
	}

	public AlignedSequence getQuery() {
		return sequences.get(0);
	}
	public AlignedSequence get(int index) {
		return sequences.get(index);
	}
	public AlignedSequence get(String id) {
		Integer index = sequenceIndexesMap.get(id);
		if(index==null) return null;
		return sequences.get(index);
	}
	public int indexOf(String id) {
		Integer index = sequenceIndexesMap.get(id);
		if(index==null) return -1;
		return index;
	}
	/**
	 * @return int Number of rows including the query
	 */
	public int size() {
		return sequences.size();
	}
	/**
	 * @return int Number of columns of the alignment
	 */
	public int getLength() {
		return sequences.get(0).getLength();
	}
	public List<AlignedSequence> getSequences() {
		return sequences;
	}
	@Override
	public Iterator<AlignedSequence> iterator() {
		return sequences.iterator();
	}

	/**
	 * Builds a new alignment keeping only the given range of columns in every row
	 * @param start Zero based first column to keep
	 * @param end Zero based column where the kept range ends (excluded)
	 * @return SequenceAlignment Alignment with end-start columns
	 */
	public SequenceAlignment subAlignment(int start, int end) {
		if(start<0 || end>getLength() || start>end) throw new IndexOutOfBoundsException("Invalid column range "+start+"-"+end+" for alignment of length "+getLength());
		List<AlignedSequence> cut = new ArrayList<AlignedSequence>(sequences.size());
		for(AlignedSequence seq:sequences) {
			AlignedSequence cutSeq = new AlignedSequence(seq.getId(), seq.getResidues().substring(start, end), seq.getIdenticalCount(), seq.getAlignedLength());
			cutSeq.setDescription(seq.getDescription());
			cutSeq.setLeadingResidues(seq.getLeadingResidues()+Aminoacids.countResidues(seq.getResidues(), 0, start));
			cutSeq.setTrailingResidues(seq.getTrailingResidues()+Aminoacids.countResidues(seq.getResidues(), end, seq.getLength()));
			cut.add(cutSeq);
		}
		return new SequenceAlignment(cut);
	}
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

import hssp.sequences.AlignedSequence;
import hssp.sequences.Aminoacids;
import hssp.sequences.SequenceAlignment;
import hssp.sequences.SubstitutionMatrix;

/**
 * Converts the rows of a multiple sequence alignment into hits of the query (first row).
 * Subclasses decide which columns at the ends of each row are trimmed before the statistics are calculated
 */
public abstract class HitBuilder {

	public static final String POLICY_PROFILE = "profile";
	public static final String POLICY_SCORE = "score";

	private Logger log = Logger.getLogger(HitBuilder.class.getName());

	private SubstitutionMatrix matrix = SubstitutionMatrix.BLOSUM62;

	/**
	 * Creates the builder for the given trimming policy
	 * @param policy Name of the policy. Either profile or score
	 * @return HitBuilder builder implementing the policy
	 */
	public static HitBuilder getInstance(String policy) {
		if(POLICY_PROFILE.equalsIgnoreCase(policy)) return new ProfileTrimHitBuilder();
		if(POLICY_SCORE.equalsIgnoreCase(policy)) return new ScoreTrimHitBuilder();
		throw new IllegalArgumentException("Unknown trimming policy: "+policy+". Valid values are "+POLICY_PROFILE+" and "+POLICY_SCORE);
	}

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		if (log == null) throw new NullPointerException("Log can not be null");
		this.log = log;
	}

	public SubstitutionMatrix getMatrix() {
		return matrix;
	}
	public void setMatrix(SubstitutionMatrix matrix) {
		if (matrix == null) throw new NullPointerException("Substitution matrix can not be null");
		this.matrix = matrix;
	}

	/**
	 * Builds the hits for every non query row of the alignment and keeps the significant ones
	 * @param alignment Alignment having the query as first row
	 * @param chainId Chain of the query
	 * @return List<Hit> Significant hits in alignment order
	 * @throws InvalidAlignmentException If the query has leading or trailing gaps or a row can not be compared with the query
	 * @throws AlignmentFormatException If a row id does not have the information required by the trimming policy
	 */
	public List<Hit> buildHits(SequenceAlignment alignment, char chainId) throws InvalidAlignmentException, AlignmentFormatException {
		List<Hit> hits = new ArrayList<Hit>();
		for(int i=1;i<alignment.size();i++) {
			Hit hit = buildHit(alignment, i, chainId);
			if(hit.isSignificant()) hits.add(hit);
			else log.fine("Hit "+hit.getId()+" not significant. Identity: "+hit.getIde()+" aligned length: "+hit.getLali());
		}
		log.info("Chain "+chainId+". Kept "+hits.size()+" hits out of "+(alignment.size()-1)+" aligned sequences");
		return hits;
	}

	/**
	 * Builds the hit for one row of the alignment
	 * @param alignment Alignment having the query as first row
	 * @param index Index of the row to compare with the query
	 * @param chainId Chain of the query
	 * @return Hit with statistics. The hit is built even if it is not significant
	 * @throws InvalidAlignmentException If the rows are empty, have different lengths or the query has leading or trailing gaps
	 * @throws AlignmentFormatException If the row id does not have the information required by the trimming policy
	 */
	public Hit buildHit(SequenceAlignment alignment, int index, char chainId) throws InvalidAlignmentException, AlignmentFormatException {
		AlignedSequence seq = alignment.get(index);
		Hit hit = buildHit(alignment.getQuery().getResidues(), seq.getId(), seq.getResidues(), seq.getLeadingResidues(), seq.getTrailingResidues());
		hit.setSourceAlignmentIndex(index);
		hit.setChainId(chainId);
		hit.setDescription(seq.getDescription());
		return hit;
	}

	/**
	 * Compares a hit row with the query row
	 * @param query Aligned query
	 * @param rowId Id of the hit row as it appears in the alignment
	 * @param row Aligned hit
	 * @return Hit with statistics. The hit is built even if it is not significant
	 * @throws InvalidAlignmentException If the rows are empty, have different lengths or the query has leading or trailing gaps
	 * @throws AlignmentFormatException If the row id does not have the information required by the trimming policy
	 */
	public Hit buildHit(String query, String rowId, String row) throws InvalidAlignmentException, AlignmentFormatException {
		return buildHit(query, rowId, row, 0, 0);
	}

	private Hit buildHit(String query, String rowId, String row, int leadingResidues, int trailingResidues) throws InvalidAlignmentException, AlignmentFormatException {
		if(query.length()==0 || row.length()==0) throw new InvalidAlignmentException("Empty sequence in alignment of "+rowId);
		if(query.length()!=row.length()) throw new InvalidAlignmentException("Row "+rowId+" has length "+row.length()+" but the query has length "+query.length());
		if(Aminoacids.isGap(query.charAt(0)) || Aminoacids.isGap(query.charAt(query.length()-1))) {
			throw new InvalidAlignmentException("Leading or trailing gaps found in query sequence aligned to "+rowId);
		}
		char [] working = row.toCharArray();
		AlignedRegion region = findAlignedRegion(rowId, query, working);
		for(int i=0;i<region.start;i++) working[i] = ' ';
		for(int i=region.end;i<working.length;i++) working[i] = ' ';

		Hit hit = new Hit(getHitId(rowId));
		int ifir = 1+Aminoacids.countResidues(query, 0, region.start);
		hit.setIfir(ifir);
		int firstHitPos = region.firstHitPos+leadingResidues;
		hit.setJfir(firstHitPos);
		scan(hit, query, working, region, firstHitPos);
		hit.setAlignedResidues(new String(working));
		if(region.hasDomain()) {
			int jfir = region.domainStart+leadingResidues;
			int jlas = region.domainEnd-trailingResidues;
			if(jlas<jfir) throw new AlignmentFormatException("Aligned positions "+jfir+"-"+jlas+" of "+rowId+" do not match the columns kept for the query");
			hit.setJfir(jfir);
			hit.setJlas(jlas);
		}
		int rowLength = firstHitPos-1-Aminoacids.countResidues(row, 0, region.start)+Aminoacids.countResidues(row, 0, row.length())+trailingResidues;
		hit.setLseq2(Math.max(hit.getJlas(), rowLength));
		return hit;
	}

	private void scan(Hit hit, String query, char [] working, AlignedRegion region, int firstHitPos) {
		int ipos = hit.getIfir();
		int jpos = firstHitPos;
		int lali = 0;
		int ngap = 0;
		int lgap = 0;
		int identical = 0;
		int similar = 0;
		boolean hitGap = false;
		boolean queryGap = false;
		int lastHitResidue = -1;
		Insertion insertion = null;
		for(int i=region.start;i<region.end;i++) {
			char q = query.charAt(i);
			char s = working[i];
			boolean qg = Aminoacids.isGap(q);
			boolean sg = Aminoacids.isGap(s);
			if(qg && sg) continue;
			if(sg) {
				if(!hitGap && !queryGap) ngap++;
				hitGap = true;
				lgap++;
				ipos++;
			} else if (qg) {
				if(!queryGap) {
					// Trimming guarantees an aligned residue before the first insertion column
					working[lastHitResidue] = Character.toLowerCase(working[lastHitResidue]);
					insertion = new Insertion(ipos-1, jpos-1);
					insertion.append(working[lastHitResidue]);
				}
				insertion.append(s);
				if(!hitGap && !queryGap) ngap++;
				queryGap = true;
				lgap++;
				jpos++;
			} else {
				if(queryGap) {
					working[i] = Character.toLowerCase(s);
					insertion.append(working[i]);
					hit.addInsertion(insertion);
					insertion = null;
				}
				hitGap = false;
				queryGap = false;
				lali++;
				if(Character.toUpperCase(q)==Character.toUpperCase(s)) {
					identical++;
					similar++;
				} else if (matrix.isScored(q) && matrix.isScored(s) && matrix.getScore(q, s)>0) {
					similar++;
				}
				lastHitResidue = i;
				ipos++;
				jpos++;
			}
		}
		hit.setIlas(Math.max(hit.getIfir(), ipos-1));
		hit.setJlas(Math.max(hit.getJfir(), jpos-1));
		hit.setLali(lali);
		hit.setNgap(ngap);
		hit.setLgap(lgap);
		hit.setIdenticalCount(identical);
		hit.setSimilarCount(similar);
		hit.updateRatios();
	}

	/**
	 * Sorts the given hits by decreasing identity, keeps the first maxHits and assigns ranks starting at one
	 * @param hits Hits to rank. The list is modified
	 * @param maxHits Maximum number of hits to keep
	 */
	public static void rankHits(List<Hit> hits, int maxHits) {
		Collections.sort(hits, new HitIdentityComparator());
		while(hits.size()>maxHits) hits.remove(hits.size()-1);
		for(int i=0;i<hits.size();i++) hits.get(i).setRank(i+1);
	}

	/**
	 * Finds the range of columns of the given row that should be compared with the query.
	 * Implementations must not leave query gaps or hit gaps at the ends of the range
	 * @param rowId Id of the row as it appears in the alignment
	 * @param query Aligned query
	 * @param row Working copy of the aligned row
	 * @return AlignedRegion Range of columns to compare and position in the hit sequence of the first residue within the range
	 * @throws AlignmentFormatException If the row id does not have the information required by the policy
	 */
	protected abstract AlignedRegion findAlignedRegion(String rowId, String query, char [] row) throws AlignmentFormatException;

	/**
	 * Calculates the id of the hit from the id of the row
	 * @param rowId Id of the row as it appears in the alignment
	 * @return String id of the hit
	 */
	protected String getHitId(String rowId) {
		return rowId;
	}

	protected static boolean isAlignedPair(String query, char [] row, int column) {
		return !Aminoacids.isGap(query.charAt(column)) && !Aminoacids.isGap(row[column]);
	}

	/**
	 * Range of columns compared with the query
	 */
	protected static class AlignedRegion {
		private final int start;
		private final int end;
		private final int firstHitPos;
		private final int domainStart;
		private final int domainEnd;

		/**
		 * @param start Zero based first column (included)
		 * @param end Zero based last column (excluded)
		 * @param firstHitPos One based position in the hit sequence of the first hit residue within the range
		 */
		public AlignedRegion(int start, int end, int firstHitPos) {
			this(start, end, firstHitPos, 0, 0);
		}
		/**
		 * Region for rows reporting the aligned domain of the hit. The domain limits are reported
		 * as first and last hit positions instead of the positions found scanning the columns
		 * @param start Zero based first column (included)
		 * @param end Zero based last column (excluded)
		 * @param firstHitPos One based position in the hit sequence of the first hit residue within the range
		 * @param domainStart One based first position of the aligned domain in the hit sequence
		 * @param domainEnd One based last position of the aligned domain in the hit sequence
		 */
		public AlignedRegion(int start, int end, int firstHitPos, int domainStart, int domainEnd) {
			this.start = start;
			this.end = Math.max(start, end);
			this.firstHitPos = firstHitPos;
			this.domainStart = domainStart;
			this.domainEnd = domainEnd;
		}
		public boolean hasDomain() {
			return domainStart>0;
		}
		public int getStart() {
			return start;
		}
		public int getEnd() {
			return end;
		}
		public int getFirstHitPos() {
			return firstHitPos;
		}
	}
}

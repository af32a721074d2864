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
package hssp.sequences.io;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import htsjdk.samtools.util.IOUtil;
import hssp.alignments.AlignmentFormatException;
import hssp.alignments.HomologyThreshold;
import hssp.sequences.AlignedSequence;
import hssp.sequences.Aminoacids;
import hssp.sequences.SequenceAlignment;

/**
 * Reads a multiple sequence alignment in Stockholm format. The query is identified by the #=GF ID line
 * that must be the second line of the file and it is always the first sequence of the loaded alignment.
 * Sequences whose identity with the query is below the homology threshold are removed by default
 */
public class StockholmFileReader implements Closeable {

	public static final String FORMAT_LINE = "# STOCKHOLM 1.0";
	public static final String QUERY_ID_PREFIX = "#=GF ID ";
	public static final String SEQUENCE_METADATA_PREFIX = "#=GS ";
	public static final String DESCRIPTION_TAG = "DE";
	public static final String END_OF_ALIGNMENT = "//";

	// jackhmmer adds the iteration number to the query id
	private static final Pattern ITERATION_SUFFIX = Pattern.compile("(.+?)-i\\d+");

	private Logger log = Logger.getLogger(StockholmFileReader.class.getName());

	private BufferedReader in;

	private boolean filterNonHomologous = true;

	public StockholmFileReader(String filename) throws IOException {
		this(new File(filename));
	}
	public StockholmFileReader(File file) throws IOException {
		in = IOUtil.openFileForBufferedReading(file);
	}
	public StockholmFileReader(InputStream stream) {
		in = new BufferedReader(new InputStreamReader(stream, StandardCharsets.US_ASCII));
	}

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		if (log == null) throw new NullPointerException("Log can not be null");
		this.log = log;
	}

	public boolean isFilterNonHomologous() {
		return filterNonHomologous;
	}
	/**
	 * Changes the behavior for sequences with identity to the query below the homology threshold.
	 * By default these sequences are removed from the loaded alignment
	 * @param filterNonHomologous true to remove non homologous sequences
	 */
	public void setFilterNonHomologous(boolean filterNonHomologous) {
		this.filterNonHomologous = filterNonHomologous;
	}

	@Override
	public void close() throws IOException {
		in.close();
	}

	/**
	 * Loads the alignment
	 * @return SequenceAlignment Alignment with the query as first sequence
	 * @throws AlignmentFormatException If the file is not a valid Stockholm file or has less than two sequences
	 * @throws IOException If the file can not be read
	 */
	public SequenceAlignment read() throws IOException {
		String line = in.readLine();
		if(line==null || !FORMAT_LINE.equals(stripEnd(line))) throw new AlignmentFormatException("Not a Stockholm file. First line must be "+FORMAT_LINE);
		line = in.readLine();
		if(line==null || !line.startsWith(QUERY_ID_PREFIX)) throw new AlignmentFormatException("Not a valid Stockholm file, missing #=GF ID line");
		String queryId = stripIterationSuffix(line.substring(QUERY_ID_PREFIX.length()).trim());
		if(queryId.length()==0) throw new AlignmentFormatException("Empty query id in #=GF ID line");

		Map<String, RowBuilder> rows = new LinkedHashMap<String, RowBuilder>();
		RowBuilder query = new RowBuilder(queryId);
		rows.put(queryId, query);
		String lastQueryBlock = null;
		int lineNumber = 2;
		while((line = in.readLine())!=null) {
			lineNumber++;
			line = stripEnd(line);
			if(line.trim().length()==0) continue;
			if(END_OF_ALIGNMENT.equals(line)) break;
			if(line.startsWith(SEQUENCE_METADATA_PREFIX)) {
				loadSequenceMetadata(line.substring(SEQUENCE_METADATA_PREFIX.length()), rows);
				continue;
			}
			if(line.charAt(0)=='#') continue;
			int i = findWhitespace(line);
			if(i<0) throw new AlignmentFormatException("Invalid Stockholm data line "+lineNumber+". Can not separate id and residues: "+line);
			String id = line.substring(0, i);
			String block = line.substring(i).trim();
			if(block.length()==0) throw new AlignmentFormatException("Invalid Stockholm data line "+lineNumber+". No residues for sequence "+id);
			if(id.equals(queryId)) {
				query.residues.append(block);
				lastQueryBlock = block;
				continue;
			}
			RowBuilder row = rows.get(id);
			if(row==null) {
				row = new RowBuilder(id);
				rows.put(id, row);
			}
			if(lastQueryBlock==null || lastQueryBlock.length()!=block.length()) {
				int queryLength = lastQueryBlock!=null?lastQueryBlock.length():0;
				throw new AlignmentFormatException("Block of sequence "+id+" at line "+lineNumber+" has length "+block.length()+" but the last query block has length "+queryLength);
			}
			row.append(block, lastQueryBlock);
		}
		if(rows.size()<2) throw new AlignmentFormatException("Insufficient sequences in Stockholm alignment of query "+queryId);
		if(query.residues.length()==0) throw new AlignmentFormatException("Query sequence "+queryId+" not found in the alignment data");
		List<AlignedSequence> sequences = new ArrayList<AlignedSequence>(rows.size());
		for(RowBuilder row:rows.values()) {
			if(row.residues.length()!=query.residues.length()) throw new AlignmentFormatException("Sequence "+row.id+" has "+row.residues.length()+" aligned columns but the query has "+query.residues.length());
			if(row!=query && filterNonHomologous && !row.isHomologous()) {
				log.fine("Dropping "+row.id+" because identity "+row.getIdentity()+" is below threshold "+HomologyThreshold.getThreshold(row.alignedLength));
				continue;
			}
			AlignedSequence seq = new AlignedSequence(row.id, row.residues.toString(), row.identical, row.alignedLength);
			seq.setDescription(row.description);
			sequences.add(seq);
		}
		return new SequenceAlignment(sequences);
	}

	/**
	 * Removes the iteration suffix added by iterative searches to the query id
	 * @param id Query id as written in the file
	 * @return String Id without the -i<number> suffix
	 */
	public static String stripIterationSuffix(String id) {
		Matcher m = ITERATION_SUFFIX.matcher(id);
		if(m.matches()) return m.group(1);
		return id;
	}

	private void loadSequenceMetadata(String data, Map<String, RowBuilder> rows) {
		String [] items = data.trim().split("\\s+", 3);
		String id = items[0];
		if(id.length()==0) return;
		RowBuilder row = rows.get(id);
		if(row==null) {
			row = new RowBuilder(id);
			rows.put(id, row);
		}
		if(items.length==3 && DESCRIPTION_TAG.equals(items[1])) {
			row.description = items[2].trim();
		}
	}

	private static int findWhitespace(String line) {
		for(int i=0;i<line.length();i++) {
			if(Character.isWhitespace(line.charAt(i))) return i;
		}
		return -1;
	}

	private static String stripEnd(String line) {
		int end = line.length();
		while(end>0 && Character.isWhitespace(line.charAt(end-1))) end--;
		return line.substring(0, end);
	}

	private static class RowBuilder {
		private final String id;
		private final StringBuilder residues = new StringBuilder();
		private String description;
		private int identical = 0;
		private int alignedLength = 0;

		RowBuilder(String id) {
			this.id = id;
		}

		/**
		 * Appends a block and updates the identity counters comparing the block with the query block
		 * read most recently
		 */
		void append(String block, String queryBlock) {
			residues.append(block);
			for(int i=0;i<block.length();i++) {
				char q = queryBlock.charAt(i);
				char s = block.charAt(i);
				boolean queryGap = Aminoacids.isGap(q);
				if(!queryGap && q==s) identical++;
				if(!queryGap || !Aminoacids.isGap(s)) alignedLength++;
			}
		}

		double getIdentity() {
			if(alignedLength==0) return 0;
			return (double)identical/alignedLength;
		}

		boolean isHomologous() {
			if(alignedLength==0) return false;
			return getIdentity()>=HomologyThreshold.getThreshold(alignedLength);
		}
	}
}

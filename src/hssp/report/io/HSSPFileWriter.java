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
package hssp.report.io;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

import htsjdk.samtools.util.IOUtil;
import hssp.alignments.HomologyThreshold;
import hssp.alignments.Hit;
import hssp.alignments.Insertion;
import hssp.profile.ResidueHInfo;
import hssp.report.HSSPReport;

/**
 * Writes reports in the fixed width HSSP format
 */
public class HSSPFileWriter {
	/**
	 * Lines are ended the same way in every platform
	 */
	public static final char END_OF_LINE = '\n';

	public static final String FORMAT_LINE = "HSSP       HOMOLOGY DERIVED SECONDARY STRUCTURE OF PROTEINS , VERSION 2.0d2 2011";
	public static final String PROTEINS_HEADER = "## PROTEINS : identifier and alignment statistics";
	public static final String PROTEINS_COLUMNS = "  NR.    ID         STRID   %IDE %WSIM IFIR ILAS JFIR JLAS LALI NGAP LGAP LSEQ2 ACCNUM     PROTEIN";
	public static final String ALIGNMENTS_HEADER = "## ALIGNMENTS";
	public static final String PROFILE_HEADER = "## SEQUENCE PROFILE AND ENTROPY";
	public static final String PROFILE_COLUMNS = " SeqNo PDBNo   V   L   I   M   F   W   Y   G   A   P   S   T   C   H   R   K   Q   E   N   D  NOCC NDEL NINS ENTROPY RELENT WEIGHT";
	public static final String INSERTIONS_HEADER = "## INSERTION LIST";
	public static final String INSERTIONS_COLUMNS = " AliNo  IPOS  JPOS   Len Sequence";
	public static final String END_OF_REPORT = "//";

	public static final int HITS_PER_BLOCK = 70;
	public static final int INSERTION_LINE_LENGTH = 100;

	private static final String PROTEIN_ROW_FORMAT = "%05d : %-12.12s%4.4s    %4.2f  %4.2f %04d %04d %04d %04d %04d %04d %04d %04d  %-10.10s %s";
	private static final String ALIGNMENT_BREAK_FORMAT = " %05d        !  !           0   0    0    0    0";
	private static final String PROFILE_BREAK_FORMAT = "%05d          0   0   0   0   0   0   0   0   0   0   0   0   0   0   0   0   0   0   0   0     0    0    0   0.000      0";

	/**
	 * Writes the given report in the given file. Files with extension .gz are compressed
	 * @param report Report to write
	 * @param filename Output file
	 * @throws IOException If the file can not be written
	 */
	public void write(HSSPReport report, String filename) throws IOException {
		try (PrintStream out = new PrintStream(IOUtil.openFileForWriting(new File(filename)), false, "US-ASCII")) {
			write(report, out);
			if(out.checkError()) throw new IOException("Error writing HSSP report to "+filename);
		}
	}

	/**
	 * Writes the given report in the given stream
	 * @param report Report to write
	 * @param out Output stream
	 */
	public void write(HSSPReport report, PrintStream out) {
		printHeader(report, out);
		printProteins(report.getHits(), out);
		printAlignments(report.getHits(), report.getResidues(), out);
		printProfiles(report.getResidues(), out);
		printInsertions(report.getHits(), out);
		printLine(out, END_OF_REPORT);
		out.flush();
	}

	private void printHeader(HSSPReport report, PrintStream out) {
		printLine(out, FORMAT_LINE);
		printLine(out, "PDBID      "+report.getProteinId());
		printLine(out, "DATE       file generated on "+report.getDate().format(DateTimeFormatter.ISO_LOCAL_DATE));
		printLine(out, "SEQBASE    "+report.getDatabankVersion());
		printLine(out, "THRESHOLD  according to: "+HomologyThreshold.DESCRIPTION);
		printLine(out, "CONTACT    "+report.getContact());
		for(String line:report.getDescriptionLines()) printLine(out, line);
		printLine(out, String.format("SEQLENGTH  %04d", report.getSeqLength()));
		printLine(out, String.format("NCHAIN     %04d chain(s) in %s data set", report.getNchain(), report.getProteinId()));
		if(report.getKchain()!=report.getNchain()) {
			printLine(out, String.format("KCHAIN     %04d chain(s) used here ; chains(s) : ", report.getKchain())+report.getUsedChainsList());
		}
		printLine(out, String.format("NALIGN     %04d", report.getHits().size()));
		printLine(out, "");
	}

	private void printProteins(List<Hit> hits, PrintStream out) {
		printLine(out, PROTEINS_HEADER);
		printLine(out, PROTEINS_COLUMNS);
		for(Hit h:hits) printLine(out, formatProteinRow(h));
	}

	/**
	 * Formats the row of the proteins table for the given hit
	 * @param h Ranked hit
	 * @return String fixed width row
	 */
	public static String formatProteinRow(Hit h) {
		return String.format(Locale.US, PROTEIN_ROW_FORMAT, h.getRank(), h.getId(), h.getPdbCode(), h.getIde(), h.getWsim(),
				h.getIfir(), h.getIlas(), h.getJfir(), h.getJlas(), h.getLali(), h.getNgap(), h.getLgap(), h.getLseq2(),
				h.getAccession(), h.getDescription());
	}

	private void printAlignments(List<Hit> hits, List<ResidueHInfo> residues, PrintStream out) {
		for(int i=0;i<hits.size();i+=HITS_PER_BLOCK) {
			int n = Math.min(i+HITS_PER_BLOCK, hits.size());
			printLine(out, String.format("%s %04d - %04d", ALIGNMENTS_HEADER, i+1, n));
			StringBuilder columns = new StringBuilder(" SeqNo  PDBNo AA STRUCTURE BP1 BP2  ACC NOCC  VAR  ");
			for(int m=0;m<HITS_PER_BLOCK/10;m++) {
				columns.append("....:....");
				columns.append(getRulerDigit(i, m));
			}
			printLine(out, columns.toString());
			for(ResidueHInfo r:residues) {
				if(r.isChainBreak()) {
					printLine(out, String.format(ALIGNMENT_BREAK_FORMAT, r.getSeqNr()));
					continue;
				}
				StringBuilder aln = new StringBuilder(n-i);
				for(int j=i;j<n;j++) {
					Hit h = hits.get(j);
					if(h.getChainId()==r.getChainId()) aln.append(h.getAlignedResidue(r.getColumnIndex()));
					else aln.append(' ');
				}
				printLine(out, String.format(" %05d%s%04d %04d  ", r.getSeqNr(), r.getDsspFragment(), r.getNocc(), r.getVariability())+aln);
			}
		}
	}

	/**
	 * Calculates the digit shown at the end of a ten column group in the header of an alignments block
	 * @param firstHit Zero based index of the first hit of the block
	 * @param group Zero based index of the group within the block
	 * @return int digit between 0 and 9
	 */
	public static int getRulerDigit(int firstHit, int group) {
		return ((firstHit+10*group)/10+1)%10;
	}

	private void printProfiles(List<ResidueHInfo> residues, PrintStream out) {
		printLine(out, PROFILE_HEADER);
		printLine(out, PROFILE_COLUMNS);
		for(ResidueHInfo r:residues) {
			if(r.isChainBreak()) {
				printLine(out, String.format(PROFILE_BREAK_FORMAT, r.getSeqNr()));
				continue;
			}
			StringBuilder row = new StringBuilder(String.format(" %04d %04d %c", r.getSeqNr(), r.getPdbNr(), r.getChainId()));
			for(int d:r.getDistribution()) row.append(String.format("%04d", d));
			row.append(String.format(Locale.US, "  %04d %04d %04d   %5.3f   %04d  %4.2f", r.getNocc(), r.getNdel(), r.getNins(), r.getEntropy(), r.getRelativeEntropy(), r.getConservation()));
			printLine(out, row.toString());
		}
	}

	private void printInsertions(List<Hit> hits, PrintStream out) {
		printLine(out, INSERTIONS_HEADER);
		printLine(out, INSERTIONS_COLUMNS);
		for(Hit h:hits) {
			for(Insertion ins:h.getInsertions()) {
				String seq = ins.getSequence();
				int end = Math.min(INSERTION_LINE_LENGTH, seq.length());
				printLine(out, String.format("  %04d  %04d  %04d  %04d ", h.getRank(), ins.getQueryPos(), ins.getHitPos(), ins.getLength())+seq.substring(0, end));
				while(end<seq.length()) {
					int start = end;
					end = Math.min(start+INSERTION_LINE_LENGTH, seq.length());
					printLine(out, "     +                   "+seq.substring(start, end));
				}
			}
		}
	}

	private static void printLine(PrintStream out, String line) {
		out.print(line);
		out.print(END_OF_LINE);
	}
}

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

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.logging.Logger;

import htsjdk.samtools.util.IOUtil;
import hssp.alignments.Hit;
import hssp.report.HSSPReport;

/**
 * Reads the header and the proteins table of an HSSP report. Alignments, profiles and insertions are not loaded
 */
public class HSSPFileReader implements Closeable {

	private static final String DATE_PREFIX = "DATE       file generated on ";
	private static final int NUMERIC_COLUMNS = 10;

	private Logger log = Logger.getLogger(HSSPFileReader.class.getName());

	private BufferedReader in;

	public HSSPFileReader(String filename) throws IOException {
		this(new File(filename));
	}
	public HSSPFileReader(File file) throws IOException {
		in = IOUtil.openFileForBufferedReading(file);
	}
	public HSSPFileReader(InputStream stream) {
		in = new BufferedReader(new InputStreamReader(stream, StandardCharsets.US_ASCII));
	}

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		if (log == null) throw new NullPointerException("Log can not be null");
		this.log = log;
	}

	@Override
	public void close() throws IOException {
		in.close();
	}

	/**
	 * Loads the report
	 * @return HSSPReport with header information and hits
	 * @throws IOException If the file can not be read or it is not a valid HSSP report
	 */
	public HSSPReport read() throws IOException {
		String line = in.readLine();
		if(line==null || !line.startsWith("HSSP ")) throw new IOException("Not an HSSP file. First line must start with HSSP");
		HSSPReport report = new HSSPReport(null);
		int nalign = -1;
		int lineNumber = 1;
		while((line=in.readLine())!=null) {
			lineNumber++;
			if(line.startsWith("PDBID")) report.setProteinId(value(line));
			else if(line.startsWith(DATE_PREFIX)) report.setDate(parseDate(line.substring(DATE_PREFIX.length()).trim(), lineNumber));
			else if(line.startsWith("SEQBASE")) report.setDatabankVersion(value(line));
			else if(line.startsWith("CONTACT")) report.setContact(value(line));
			else if(line.startsWith("HEADER") || line.startsWith("COMPND") || line.startsWith("SOURCE") || line.startsWith("AUTHOR")) report.addDescriptionLine(line);
			else if(line.startsWith("SEQLENGTH")) report.setSeqLength(parseInt(firstToken(value(line)), lineNumber));
			else if(line.startsWith("NCHAIN")) report.setNchain(parseInt(firstToken(value(line)), lineNumber));
			else if(line.startsWith("NALIGN")) nalign = parseInt(firstToken(value(line)), lineNumber);
			else if(line.startsWith(HSSPFileWriter.PROTEINS_HEADER)) break;
		}
		if(line==null) throw new IOException("Proteins section not found in HSSP file");
		if(nalign<0) throw new IOException("NALIGN line not found in HSSP file");
		in.readLine();
		lineNumber++;
		for(int i=0;i<nalign;i++) {
			line = in.readLine();
			lineNumber++;
			if(line==null || line.startsWith("##")) throw new IOException("Expected "+nalign+" hits in the proteins section but found only "+i);
			report.addHit(parseProteinRow(line, lineNumber));
		}
		log.info("Loaded "+nalign+" hits from HSSP report of protein "+report.getProteinId());
		return report;
	}

	/**
	 * Parses one row of the proteins table
	 * @param line Row of the table
	 * @param lineNumber Number of the line for error messages
	 * @return Hit with the statistics of the row
	 * @throws IOException If the row does not have the expected format
	 */
	public static Hit parseProteinRow(String line, int lineNumber) throws IOException {
		if(line.length()<24 || line.charAt(6)!=':') throw new IOException("Invalid proteins row at line "+lineNumber+": "+line);
		Hit hit = new Hit(line.substring(8, 20).trim());
		hit.setRank(parseInt(line.substring(0, 5).trim(), lineNumber));
		hit.setPdbCode(line.substring(20, 24).trim());
		int [] ints = new int [NUMERIC_COLUMNS-2];
		double [] ratios = new double [2];
		int pos = 24;
		for(int k=0;k<NUMERIC_COLUMNS;k++) {
			while(pos<line.length() && line.charAt(pos)==' ') pos++;
			int end = pos;
			while(end<line.length() && line.charAt(end)!=' ') end++;
			if(end==pos) throw new IOException("Missing statistics in proteins row at line "+lineNumber+": "+line);
			String token = line.substring(pos, end);
			if(k<2) {
				try {
					ratios[k] = Double.parseDouble(token);
				} catch (NumberFormatException e) {
					throw new IOException("Invalid ratio "+token+" at line "+lineNumber, e);
				}
			} else {
				ints[k-2] = parseInt(token, lineNumber);
			}
			pos = end;
		}
		hit.setIde(ratios[0]);
		hit.setWsim(ratios[1]);
		hit.setIfir(ints[0]);
		hit.setIlas(ints[1]);
		hit.setJfir(ints[2]);
		hit.setJlas(ints[3]);
		hit.setLali(ints[4]);
		hit.setNgap(ints[5]);
		hit.setLgap(ints[6]);
		hit.setLseq2(ints[7]);
		// Two spaces, ten characters of accession and one space precede the description
		int accStart = pos+2;
		if(accStart<line.length()) {
			hit.setAccession(line.substring(accStart, Math.min(accStart+10, line.length())).trim());
			if(accStart+11<line.length()) hit.setDescription(line.substring(accStart+11));
		}
		return hit;
	}

	private static String value(String line) {
		if(line.length()<=11) return "";
		return line.substring(11).trim();
	}
	private static String firstToken(String value) {
		int i = value.indexOf(' ');
		if(i<0) return value;
		return value.substring(0, i);
	}
	private static int parseInt(String value, int lineNumber) throws IOException {
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IOException("Invalid number "+value+" at line "+lineNumber, e);
		}
	}
	private static LocalDate parseDate(String value, int lineNumber) throws IOException {
		try {
			return LocalDate.parse(value);
		} catch (DateTimeParseException e) {
			throw new IOException("Invalid date "+value+" at line "+lineNumber, e);
		}
	}
}

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
package hssp.proteins.io;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

import htsjdk.samtools.util.IOUtil;
import hssp.proteins.ChainResidue;
import hssp.proteins.Protein;
import hssp.proteins.ProteinChain;

/**
 * Loads the chains of a protein from a file produced by DSSP. Header records are kept as description lines
 * and residue lines provide the structure numbering and the secondary structure columns of each residue
 */
public class DSSPFileReader implements Closeable {

	public static final String RESIDUES_MARKER = "  #  RESIDUE";
	public static final String UNKNOWN_ID = "UNKN";
	public static final int FRAGMENT_START = 5;
	public static final int FRAGMENT_END = 39;

	private Logger log = Logger.getLogger(DSSPFileReader.class.getName());

	private BufferedReader in;

	public DSSPFileReader(String filename) throws IOException {
		this(new File(filename));
	}
	public DSSPFileReader(File file) throws IOException {
		in = IOUtil.openFileForBufferedReading(file);
	}
	public DSSPFileReader(InputStream stream) {
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
	 * Loads the protein
	 * @return Protein with chains in file order
	 * @throws IOException If the file can not be read or if a residue line is malformed
	 */
	public Protein read() throws IOException {
		String header = null;
		String compound = null;
		String source = null;
		String author = null;
		String line;
		boolean residues = false;
		int lineNumber = 0;
		Map<Character, ProteinChain> chains = new LinkedHashMap<Character, ProteinChain>();
		while((line=in.readLine())!=null) {
			lineNumber++;
			if(!residues) {
				if(line.startsWith("HEADER")) header = line;
				else if(line.startsWith("COMPND")) compound = line;
				else if(line.startsWith("SOURCE")) source = line;
				else if(line.startsWith("AUTHOR")) author = line;
				else if(line.startsWith(RESIDUES_MARKER)) residues = true;
				continue;
			}
			if(line.length()<14) continue;
			char aa = line.charAt(13);
			if(aa=='!') continue;
			int pdbNr;
			try {
				pdbNr = Integer.parseInt(line.substring(5, 10).trim());
			} catch (NumberFormatException e) {
				throw new IOException("Invalid residue number at line "+lineNumber+": "+line, e);
			}
			char chainId = line.charAt(11);
			// Cysteines forming disulfide bridges are reported in lower case
			if(aa>='a' && aa<='z') aa = 'C';
			ProteinChain chain = chains.get(chainId);
			if(chain==null) {
				chain = new ProteinChain(chainId);
				chains.put(chainId, chain);
			}
			chain.addResidue(new ChainResidue(pdbNr, aa, extractFragment(line)));
		}
		if(!residues) throw new IOException("Residues section not found in DSSP file");
		String id = UNKNOWN_ID;
		if(header!=null && header.length()>=66) {
			String candidate = header.substring(62, 66).trim();
			if(candidate.length()>0) id = candidate;
		}
		Protein protein = new Protein(id);
		if(header!=null) protein.addDescriptionLine("HEADER     "+substring(header, 10, 50));
		if(compound!=null) protein.addDescriptionLine("COMPND     "+substring(compound, 10, compound.length()));
		if(source!=null) protein.addDescriptionLine("SOURCE     "+substring(source, 10, source.length()));
		if(author!=null) protein.addDescriptionLine("AUTHOR     "+substring(author, 10, author.length()));
		for(ProteinChain chain:chains.values()) protein.addChain(chain);
		log.info("Loaded protein "+id+" with "+chains.size()+" chains");
		return protein;
	}

	private static String extractFragment(String line) {
		StringBuilder fragment = new StringBuilder(substring(line, FRAGMENT_START, FRAGMENT_END));
		while(fragment.length()<FRAGMENT_END-FRAGMENT_START) fragment.append(' ');
		return fragment.toString();
	}

	private static String substring(String line, int start, int end) {
		if(start>=line.length()) return "";
		return line.substring(start, Math.min(end, line.length()));
	}
}

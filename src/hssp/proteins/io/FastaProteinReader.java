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
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import htsjdk.samtools.util.IOUtil;
import hssp.proteins.ChainResidue;
import hssp.proteins.Protein;
import hssp.proteins.ProteinChain;

/**
 * Loads a protein from a fasta file in which each sequence is a chain. Residues are numbered from one and
 * the secondary structure columns are left empty
 */
public class FastaProteinReader implements Closeable {

	private Logger log = Logger.getLogger(FastaProteinReader.class.getName());

	private BufferedReader in;

	private String proteinId = DSSPFileReader.UNKNOWN_ID;

	public FastaProteinReader(String filename) throws IOException {
		this(new File(filename));
	}
	public FastaProteinReader(File file) throws IOException {
		in = IOUtil.openFileForBufferedReading(file);
	}
	public FastaProteinReader(InputStream stream) {
		in = new BufferedReader(new InputStreamReader(stream, StandardCharsets.US_ASCII));
	}

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		if (log == null) throw new NullPointerException("Log can not be null");
		this.log = log;
	}

	public String getProteinId() {
		return proteinId;
	}
	public void setProteinId(String proteinId) {
		this.proteinId = proteinId;
	}

	@Override
	public void close() throws IOException {
		in.close();
	}

	/**
	 * Loads the sequences of the file as chains of a protein
	 * @return Protein with one chain per sequence
	 * @throws IOException If the file can not be read or if two sequences are assigned to the same chain
	 */
	public Protein read() throws IOException {
		List<String> names = new ArrayList<String>();
		List<StringBuilder> sequences = new ArrayList<StringBuilder>();
		String line;
		StringBuilder current = null;
		while((line=in.readLine())!=null) {
			if(line.startsWith(">")) {
				String idLine = line.substring(1).trim();
				String [] items = idLine.split(" |\t");
				names.add(items[0]);
				current = new StringBuilder();
				sequences.add(current);
			} else if (current!=null && !line.startsWith("#")) {
				for(int i=0;i<line.length();i++) {
					char c = line.charAt(i);
					if(!Character.isWhitespace(c)) current.append(Character.toUpperCase(c));
				}
			}
		}
		Protein protein = new Protein(proteinId);
		Set<Character> usedIds = new HashSet<Character>();
		char nextId = 'A';
		for(int i=0;i<names.size();i++) {
			String name = names.get(i);
			Character chainId = getChainId(name);
			if(chainId==null) {
				while(usedIds.contains(nextId)) nextId++;
				chainId = nextId;
			}
			if(!usedIds.add(chainId)) throw new IOException("Sequence "+name+" assigned to chain "+chainId+" but the chain was already loaded");
			String seq = sequences.get(i).toString();
			ProteinChain chain = new ProteinChain(chainId);
			for(int j=0;j<seq.length();j++) {
				int pdbNr = j+1;
				chain.addResidue(new ChainResidue(pdbNr, seq.charAt(j), buildFragment(pdbNr, chainId, seq.charAt(j))));
			}
			protein.addChain(chain);
		}
		log.info("Loaded "+names.size()+" chains from fasta file for protein "+proteinId);
		return protein;
	}

	/**
	 * Builds the DSSP columns of a residue without secondary structure information
	 * @param pdbNr Residue number
	 * @param chainId Chain of the residue
	 * @param aminoacid Residue
	 * @return String of the same width as the fragment taken from DSSP lines
	 */
	public static String buildFragment(int pdbNr, char chainId, char aminoacid) {
		return String.format("%5d %c %c  %9s%4d%4d %4d ", pdbNr, chainId, aminoacid, "", 0, 0, 0);
	}

	/**
	 * Infers the chain id from a sequence name. Names of one character, or names ending with _X or :X
	 * identify chain X
	 */
	private static Character getChainId(String name) {
		if(name.length()==1) return name.charAt(0);
		int n = name.length();
		if(n>=2 && (name.charAt(n-2)=='_' || name.charAt(n-2)==':')) return name.charAt(n-1);
		return null;
	}
}

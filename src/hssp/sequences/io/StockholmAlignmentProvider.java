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

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

import hssp.alignments.AlignmentProvider;
import hssp.sequences.SequenceAlignment;

/**
 * Provides alignments stored in Stockholm files, one file per chain
 */
public class StockholmAlignmentProvider implements AlignmentProvider {

	private Logger log = Logger.getLogger(StockholmAlignmentProvider.class.getName());

	private Map<Character, String> files = new LinkedHashMap<Character, String>();

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		if (log == null) throw new NullPointerException("Log can not be null");
		this.log = log;
	}

	/**
	 * Registers the file with the alignment of a chain
	 * @param chainId Id of the chain
	 * @param filename Stockholm file. It can be gzip compressed
	 */
	public void addFile(char chainId, String filename) {
		String previous = files.get(chainId);
		if(previous!=null) throw new IllegalArgumentException("Two alignment files given for chain "+chainId+": "+previous+" and "+filename);
		files.put(chainId, filename);
	}

	public Map<Character, String> getFiles() {
		return Collections.unmodifiableMap(files);
	}

	@Override
	public boolean hasAlignment(char chainId) {
		return files.containsKey(chainId);
	}

	@Override
	public SequenceAlignment getAlignment(char chainId, String chainSequence) throws IOException {
		String filename = files.get(chainId);
		if(filename==null) throw new IOException("No Stockholm file given for chain "+chainId);
		log.info("Loading alignment of chain "+chainId+" from "+filename);
		SequenceAlignment alignment;
		try (StockholmFileReader reader = new StockholmFileReader(filename)) {
			reader.setLog(log);
			alignment = reader.read();
		}
		log.info("Loaded alignment of chain "+chainId+" with "+alignment.size()+" sequences and "+alignment.getLength()+" columns");
		return alignment;
	}
}

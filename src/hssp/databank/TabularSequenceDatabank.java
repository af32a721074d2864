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
package hssp.databank;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

import htsjdk.samtools.util.IOUtil;

/**
 * Databank loaded from a tab delimited file with the columns id, accession, length and description.
 * Lines starting with # are ignored
 */
public class TabularSequenceDatabank implements SequenceDatabank {

	private Logger log = Logger.getLogger(TabularSequenceDatabank.class.getName());

	private String version = "";
	private Map<String, DatabankEntry> entries = new HashMap<String, DatabankEntry>();

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		if (log == null) throw new NullPointerException("Log can not be null");
		this.log = log;
	}

	@Override
	public String getVersion() {
		return version;
	}
	public void setVersion(String version) {
		this.version = version!=null?version:"";
	}

	public void addEntry(DatabankEntry entry) {
		entries.put(entry.getId(), entry);
	}

	public int size() {
		return entries.size();
	}

	@Override
	public DatabankEntry lookup(String id) {
		return entries.get(id);
	}

	/**
	 * Loads the entries from the given file
	 * @param filename Tab delimited file. It can be gzip compressed
	 * @throws IOException If the file can not be read or if a line does not have the expected columns
	 */
	public void load(String filename) throws IOException {
		int lineNumber = 0;
		try (BufferedReader in = IOUtil.openFileForBufferedReading(new File(filename))) {
			String line;
			while((line=in.readLine())!=null) {
				lineNumber++;
				if(line.startsWith("#") || line.trim().length()==0) continue;
				String [] items = line.split("\t");
				if(items.length<3) throw new IOException("Line "+lineNumber+" of databank file "+filename+" should have at least 3 tab separated columns: "+line);
				int length;
				try {
					length = Integer.parseInt(items[2].trim());
				} catch (NumberFormatException e) {
					throw new IOException("Invalid sequence length at line "+lineNumber+" of databank file "+filename+": "+items[2], e);
				}
				String description = items.length>3?items[3]:"";
				addEntry(new DatabankEntry(items[0], items[1], description, length));
			}
		}
		log.info("Loaded "+entries.size()+" entries from databank file "+filename);
	}
}

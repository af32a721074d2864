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
package hssp.report;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import hssp.alignments.AlignmentProvider;
import hssp.alignments.Hit;
import hssp.alignments.HitBuilder;
import hssp.alignments.InvalidAlignmentException;
import hssp.clustering.ContainedSequencesClustering;
import hssp.databank.DatabankEntry;
import hssp.databank.SequenceDatabank;
import hssp.databank.TabularSequenceDatabank;
import hssp.main.CommandsDescriptor;
import hssp.main.OptionValuesDecoder;
import hssp.profile.ResidueHInfo;
import hssp.profile.ResidueProfileBuilder;
import hssp.proteins.Protein;
import hssp.proteins.ProteinChain;
import hssp.proteins.io.DSSPFileReader;
import hssp.proteins.io.FastaProteinReader;
import hssp.report.io.HSSPFileWriter;
import hssp.sequences.Aminoacids;
import hssp.sequences.SequenceAlignment;
import hssp.sequences.io.StockholmAlignmentProvider;

/**
 * Builds the HSSP report of a protein from the multiple sequence alignments of its chains
 */
public class HSSPReportBuilder {

	// Constants for default values
	public static final int DEF_MIN_LENGTH = 25;
	public static final int DEF_MAX_HITS = HSSPReport.MAX_HITS;
	public static final String DEF_TRIMMING_POLICY = HitBuilder.POLICY_PROFILE;
	public static final String UNIREF100_PREFIX = "UniRef100_";

	// Logging and progress
	private Logger log = Logger.getLogger(HSSPReportBuilder.class.getName());

	// Parameters
	private String dsspFile = null;
	private String fastaFile = null;
	private String outputFile = null;
	private String databankFile = null;
	private String databankVersion = null;
	private String trimmingPolicy = DEF_TRIMMING_POLICY;
	private int minLength = DEF_MIN_LENGTH;
	private int maxHits = DEF_MAX_HITS;
	private String proteinId = null;
	private String contact = HSSPReport.DEFAULT_CONTACT;
	private boolean skipFailedChains = false;
	private StockholmAlignmentProvider alignmentFiles = new StockholmAlignmentProvider();

	// Model attributes
	private SequenceDatabank databank = null;

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		if (log == null) throw new NullPointerException("Log can not be null");
		this.log = log;
	}

	public String getDsspFile() {
		return dsspFile;
	}
	public void setDsspFile(String dsspFile) {
		this.dsspFile = dsspFile;
	}
	public String getFastaFile() {
		return fastaFile;
	}
	public void setFastaFile(String fastaFile) {
		this.fastaFile = fastaFile;
	}
	public String getOutputFile() {
		return outputFile;
	}
	public void setOutputFile(String outputFile) {
		this.outputFile = outputFile;
	}
	public String getDatabankFile() {
		return databankFile;
	}
	public void setDatabankFile(String databankFile) {
		this.databankFile = databankFile;
	}
	public String getDatabankVersion() {
		return databankVersion;
	}
	public void setDatabankVersion(String databankVersion) {
		this.databankVersion = databankVersion;
	}
	public String getTrimmingPolicy() {
		return trimmingPolicy;
	}
	public void setTrimmingPolicy(String trimmingPolicy) {
		this.trimmingPolicy = trimmingPolicy;
	}
	public int getMinLength() {
		return minLength;
	}
	public void setMinLength(int minLength) {
		if(minLength<1) throw new IllegalArgumentException("Minimum chain length must be positive. Invalid value: "+minLength);
		this.minLength = minLength;
	}
	public void setMinLength(String value) {
		setMinLength((int)OptionValuesDecoder.decode(value, Integer.class));
	}
	public int getMaxHits() {
		return maxHits;
	}
	public void setMaxHits(int maxHits) {
		if(maxHits<0 || maxHits>HSSPReport.MAX_HITS) throw new IllegalArgumentException("Maximum number of hits must be between 0 and "+HSSPReport.MAX_HITS+". Invalid value: "+maxHits);
		this.maxHits = maxHits;
	}
	public void setMaxHits(String value) {
		setMaxHits((int)OptionValuesDecoder.decode(value, Integer.class));
	}
	public String getProteinId() {
		return proteinId;
	}
	public void setProteinId(String proteinId) {
		this.proteinId = proteinId;
	}
	public String getContact() {
		return contact;
	}
	public void setContact(String contact) {
		this.contact = contact;
	}
	public boolean isSkipFailedChains() {
		return skipFailedChains;
	}
	public void setSkipFailedChains(boolean skipFailedChains) {
		this.skipFailedChains = skipFailedChains;
	}
	public void setSkipFailedChains(Boolean skipFailedChains) {
		this.setSkipFailedChains(skipFailedChains.booleanValue());
	}
	public SequenceDatabank getDatabank() {
		return databank;
	}
	public void setDatabank(SequenceDatabank databank) {
		this.databank = databank;
	}

	/**
	 * Registers the alignment file of a chain given as CHAIN=FILE
	 * @param argument Chain id and file separated by =
	 */
	public void addAlignmentFile(String argument) {
		int idx = argument.indexOf('=');
		if(idx<0 || idx==argument.length()-1) throw new IllegalArgumentException("Invalid chain/alignment pair specified: "+argument+". Expected CHAIN=FILE");
		char chainId = OptionValuesDecoder.decodeChainId(argument.substring(0, idx));
		alignmentFiles.addFile(chainId, argument.substring(idx+1));
	}

	public static void main(String[] args) throws Exception {
		HSSPReportBuilder instance = new HSSPReportBuilder();
		int i = CommandsDescriptor.getInstance().loadOptions(instance, args);
		for(;i<args.length;i++) {
			instance.addAlignmentFile(args[i]);
		}
		instance.run();
	}

	public void run() throws IOException {
		logParameters();
		if(dsspFile==null && fastaFile==null) throw new IOException("Either a DSSP file or a fasta file with the chains is required");
		if(dsspFile!=null && fastaFile!=null) throw new IOException("Only one of the DSSP or the fasta files can be provided");
		if(alignmentFiles.getFiles().isEmpty()) throw new IOException("At least one alignment file must be provided as CHAIN=FILE");
		if(!HitBuilder.POLICY_PROFILE.equalsIgnoreCase(trimmingPolicy) && !HitBuilder.POLICY_SCORE.equalsIgnoreCase(trimmingPolicy)) {
			throw new IOException("Unknown trimming policy "+trimmingPolicy+". Valid values are "+HitBuilder.POLICY_PROFILE+" and "+HitBuilder.POLICY_SCORE);
		}
		Protein protein = loadProtein();
		if(databankFile!=null) {
			TabularSequenceDatabank tabular = new TabularSequenceDatabank();
			tabular.setLog(log);
			tabular.load(databankFile);
			tabular.setVersion(databankVersion);
			databank = tabular;
		}
		alignmentFiles.setLog(log);
		HSSPReport report = buildReport(protein, alignmentFiles);
		HSSPFileWriter writer = new HSSPFileWriter();
		if(outputFile==null) {
			writer.write(report, System.out);
		} else {
			writer.write(report, outputFile);
			log.info("Written HSSP report with "+report.getHits().size()+" hits to "+outputFile);
		}
	}

	private void logParameters() {
		ByteArrayOutputStream os = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(os);
		if(dsspFile!=null) out.println("DSSP file: "+dsspFile);
		if(fastaFile!=null) out.println("Fasta file: "+fastaFile);
		out.println("Alignment files: "+alignmentFiles.getFiles());
		if(outputFile!=null) out.println("Output file: "+outputFile);
		else out.println("Report written to standard output");
		if(databankFile!=null) out.println("Databank metadata file: "+databankFile);
		if(databankVersion!=null) out.println("Databank version: "+databankVersion);
		out.println("Trimming policy: "+trimmingPolicy);
		out.println("Minimum chain length: "+minLength);
		out.println("Maximum number of hits: "+maxHits);
		if(proteinId!=null) out.println("Protein id: "+proteinId);
		if(skipFailedChains) out.println("Chains failing to align will be skipped");
		log.info(os.toString());
	}

	private Protein loadProtein() throws IOException {
		Protein protein;
		if(dsspFile!=null) {
			try (DSSPFileReader reader = new DSSPFileReader(dsspFile)) {
				reader.setLog(log);
				protein = reader.read();
			}
		} else {
			try (FastaProteinReader reader = new FastaProteinReader(fastaFile)) {
				reader.setLog(log);
				protein = reader.read();
			}
		}
		if(proteinId!=null) protein.setId(proteinId);
		return protein;
	}

	/**
	 * Builds the report of the given protein. Chains shorter than the minimum length are ignored and
	 * chains contained in other chains are represented by the chain containing them
	 * @param protein Protein with the chains to process
	 * @param provider Source of the alignments of the representative chains
	 * @return HSSPReport report with ranked hits and residue profiles
	 * @throws IOException If no chain is long enough or if a chain can not be processed and failed chains are not skipped
	 */
	public HSSPReport buildReport(Protein protein, AlignmentProvider provider) throws IOException {
		List<ProteinChain> chains = new ArrayList<ProteinChain>();
		List<String> sequences = new ArrayList<String>();
		for(ProteinChain chain:protein.getChains()) {
			if(chain.getLength()<minLength) {
				log.info("Ignoring chain "+chain.getId()+" of length "+chain.getLength());
				continue;
			}
			chains.add(chain);
			sequences.add(chain.getSequence());
		}
		if(chains.isEmpty()) throw new IOException("Not enough sequences of length at least "+minLength+" in protein "+protein.getId());
		ContainedSequencesClustering clustering = new ContainedSequencesClustering();
		clustering.setLog(log);
		List<Integer> representatives = clustering.cluster(sequences);
		for(int i=0;i<chains.size();i++) {
			char chainId = chains.get(i).getId();
			if(!representatives.contains(i) && provider.hasAlignment(chainId)) {
				log.warning("Chain "+chainId+" is contained in chain "+chains.get(clustering.getRepresentative(i)).getId()+". Its alignment will not be used");
			}
		}

		HSSPReport report = new HSSPReport(protein.getId());
		for(String line:protein.getDescriptionLines()) report.addDescriptionLine(line);
		if(databank!=null) report.setDatabankVersion(databank.getVersion());
		if(databankVersion!=null) report.setDatabankVersion(databankVersion);
		report.setContact(contact);
		report.setNchain(chains.size());
		HitBuilder hitBuilder = HitBuilder.getInstance(trimmingPolicy);
		hitBuilder.setLog(log);
		ResidueProfileBuilder profileBuilder = new ResidueProfileBuilder();
		profileBuilder.setLog(log);
		for(int i:representatives) {
			ProteinChain chain = chains.get(i);
			try {
				processChain(chain, provider, hitBuilder, profileBuilder, report);
			} catch (IOException | InvalidAlignmentException e) {
				if(!skipFailedChains) {
					if(e instanceof IOException) throw (IOException)e;
					throw new IOException("Can not process alignment of chain "+chain.getId()+": "+e.getMessage(), e);
				}
				log.warning("Skipping chain "+chain.getId()+". "+e.getMessage());
			}
		}
		if(report.getKchain()==0) throw new IOException("None of the chains of protein "+protein.getId()+" could be processed");
		report.rankHits(maxHits);
		log.info("Built report of protein "+protein.getId()+" with "+report.getHits().size()+" hits and "+report.getResidues().size()+" residues");
		return report;
	}

	private void processChain(ProteinChain chain, AlignmentProvider provider, HitBuilder hitBuilder, ResidueProfileBuilder profileBuilder, HSSPReport report) throws IOException, InvalidAlignmentException {
		String sequence = chain.getSequence();
		SequenceAlignment alignment = provider.getAlignment(chain.getId(), sequence);
		alignment = restrictToChain(alignment, sequence);
		List<Hit> hits = hitBuilder.buildHits(alignment, chain.getId());
		annotateHits(hits);
		List<ResidueHInfo> residues = profileBuilder.buildProfiles(chain, alignment.getQuery().getResidues(), hits);
		report.addChainResults(chain.getId(), chain.getLength(), hits, residues);
	}

	/**
	 * Removes the columns of the alignment holding query residues located before or after the given chain sequence
	 * @param alignment Alignment built for a query that contains the chain sequence
	 * @param chainSequence Sequence of the chain
	 * @return SequenceAlignment alignment whose query is exactly the chain sequence
	 * @throws InvalidAlignmentException If the query of the alignment does not contain the chain sequence
	 */
	public static SequenceAlignment restrictToChain(SequenceAlignment alignment, String chainSequence) throws InvalidAlignmentException {
		String queryRow = alignment.getQuery().getResidues();
		String query = Aminoacids.removeGaps(queryRow).toUpperCase();
		String chain = chainSequence.toUpperCase();
		if(query.equals(chain)) return alignment;
		if(query.length()<chain.length()) throw new InvalidAlignmentException("Query used for alignment "+alignment.getQuery().getId()+" is too short for the chain");
		int offset = query.indexOf(chain);
		if(offset<0) throw new InvalidAlignmentException("Query of alignment "+alignment.getQuery().getId()+" does not contain the chain sequence");
		int start = -1;
		int end = -1;
		int residue = 0;
		for(int i=0;i<queryRow.length();i++) {
			if(Aminoacids.isGap(queryRow.charAt(i))) continue;
			if(residue==offset) start = i;
			if(residue==offset+chain.length()-1) {
				end = i+1;
				break;
			}
			residue++;
		}
		return alignment.subAlignment(start, end);
	}

	/**
	 * Fills the accession, description and sequence length of the given hits from the databank
	 * @param hits Hits to annotate
	 */
	public void annotateHits(List<Hit> hits) {
		for(Hit hit:hits) {
			String id = hit.getId();
			DatabankEntry entry = null;
			if(databank!=null) entry = databank.lookup(id);
			if(id.startsWith(UNIREF100_PREFIX)) {
				id = id.substring(UNIREF100_PREFIX.length());
				hit.setId(id);
				hit.setAccession(id);
				if(entry==null && databank!=null) entry = databank.lookup(id);
			}
			if(entry==null) {
				if(databank!=null) log.warning("Sequence "+id+" not found in the databank");
				continue;
			}
			if(hit.getAccession().length()==0) hit.setAccession(entry.getAccession());
			if(entry.getDescription()!=null && entry.getDescription().length()>0) hit.setDescription(entry.getDescription());
			if(entry.getLength()>0) hit.setLseq2(Math.max(hit.getJlas(), entry.getLength()));
		}
	}
}

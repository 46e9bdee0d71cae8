package dnascan.programs;

import java.io.BufferedWriter;
import java.io.FileWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import dnascan.core.matcher.MatchRecord;
import dnascan.core.matcher.MatcherFactory;
import dnascan.core.matcher.SequenceMatcher;
import dnascan.core.parser.CommandLineParser;
import dnascan.core.sequence.FastaSequenceReader;
import dnascan.core.sequence.Sequence;
import dnascan.core.sequence.SequenceUtils;
import dnascan.motif.Motif;
import dnascan.motif.MotifDatabase;

/**
 * Find occurrences of patterns and named motifs in DNA sequences and write them as a table
 */
public class PatternSearch {

	static Logger logger = Logger.getLogger(PatternSearch.class.getName());

	/**
	 * Header line of the output table
	 */
	public static final String HEADER = "sequence\tname\tpattern\tstart\tend\tstrand\tscore";

	private final List<String> names;
	private final SequenceMatcher matcher;
	private final boolean bothStrands;

	/**
	 * @param patternNames Display name of each pattern
	 * @param patterns Patterns, upper case
	 * @param searchReverseStrand Whether to also report occurrences on the reverse complement strand
	 */
	public PatternSearch(List<String> patternNames, List<String> patterns, boolean searchReverseStrand) {
		if(patternNames.size() != patterns.size()) {
			throw new IllegalArgumentException("Need one name per pattern");
		}
		names = new ArrayList<String>(patternNames);
		matcher = MatcherFactory.buildMatcher(patterns);
		bothStrands = searchReverseStrand;
	}

	/**
	 * Build a search for raw patterns and named motifs
	 * Raw patterns are named after themselves
	 * @param patterns Raw patterns, any case
	 * @param motifNames Names of motifs in the database
	 * @param motifs Motif database
	 * @param searchReverseStrand Whether to also search the reverse complement strand
	 * @return The search
	 */
	public static PatternSearch create(List<String> patterns, List<String> motifNames, MotifDatabase motifs, boolean searchReverseStrand) {
		List<String> allNames = new ArrayList<String>();
		List<String> allPatterns = new ArrayList<String>();
		for(String p : patterns) {
			allNames.add(p.toUpperCase());
			allPatterns.add(p.toUpperCase());
		}
		for(Motif m : motifs.getMotifs(motifNames)) {
			allNames.add(m.getName());
			allPatterns.add(m.getSequence());
		}
		return new PatternSearch(allNames, allPatterns, searchReverseStrand);
	}

	/**
	 * @return The matcher used for all sequences
	 */
	public SequenceMatcher getMatcher() {
		return matcher;
	}

	/**
	 * Find all occurrences in one sequence
	 * Reverse strand hits are reported in forward strand coordinates and come after forward strand hits
	 * @param seq The sequence, any case
	 * @return The hits
	 */
	public List<Hit> search(Sequence seq) {
		String bases = SequenceUtils.normalize(seq.getSequenceBases());
		List<Hit> rtrn = new ArrayList<Hit>();
		for(MatchRecord r : matcher.scan(bases)) {
			rtrn.add(new Hit(seq.getId(), names.get(r.getPatternIndex()), r.getPattern(), r.getStart(), r.getEnd(), '+', r.getScore()));
		}
		if(bothStrands) {
			List<MatchRecord> reverse = new ArrayList<MatchRecord>();
			for(MatchRecord r : matcher.scan(SequenceUtils.reverseComplement(bases))) {
				reverse.add(new MatchRecord(bases.length() - r.getEnd(), r.getPatternIndex(), r.getPattern()));
			}
			Collections.sort(reverse);
			for(MatchRecord r : reverse) {
				rtrn.add(new Hit(seq.getId(), names.get(r.getPatternIndex()), r.getPattern(), r.getStart(), r.getEnd(), '-', r.getScore()));
			}
		}
		logger.debug("Found " + rtrn.size() + " hits in " + seq.getId());
		return rtrn;
	}

	/**
	 * Search every sequence and write the hit table
	 * @param seqs Sequences
	 * @param writer Output writer
	 * @return Total number of hits
	 * @throws IOException
	 */
	public int writeHits(List<Sequence> seqs, Writer writer) throws IOException {
		int total = 0;
		writer.write(HEADER + "\n");
		for(Sequence seq : seqs) {
			for(Hit h : search(seq)) {
				writer.write(h.toString() + "\n");
				total++;
			}
		}
		writer.flush();
		return total;
	}

	/**
	 * One occurrence of a pattern in a named sequence
	 */
	public static class Hit {

		private final String sequenceId;
		private final String name;
		private final String pattern;
		private final int start;
		private final int end;
		private final char strand;
		private final double score;

		Hit(String sequenceId, String name, String pattern, int start, int end, char strand, double score) {
			this.sequenceId = sequenceId;
			this.name = name;
			this.pattern = pattern;
			this.start = start;
			this.end = end;
			this.strand = strand;
			this.score = score;
		}

		public String getSequenceId() {
			return sequenceId;
		}

		public String getName() {
			return name;
		}

		public String getPattern() {
			return pattern;
		}

		public int getStart() {
			return start;
		}

		public int getEnd() {
			return end;
		}

		public char getStrand() {
			return strand;
		}

		public double getScore() {
			return score;
		}

		@Override
		public String toString() {
			return sequenceId + "\t" + name + "\t" + pattern + "\t" + start + "\t" + end + "\t" + strand + "\t" + score;
		}

	}

	/**
	 * @param args Command line
	 * @throws IOException
	 */
	public static void main(String[] args) throws IOException {

		CommandLineParser p = new CommandLineParser();
		p.setProgramDescription("Find exact occurrences of DNA patterns and known motifs. N in a sequence matches any base.");
		p.addBooleanArg("-d", "Debug logging on", false, false);
		p.addStringArg("-s", "Sequence to search", false);
		p.addStringArg("-f", "Fasta file of sequences to search", false);
		p.addStringListArg("-p", "Comma separated patterns over A, C, G, T", false);
		p.addStringListArg("-m", "Comma separated motif names (options: " + String.join(", ", MotifDatabase.getDefault().listMotifNames()) + ")", false);
		p.addStringArg("-mf", "File of motif names, one per line", false);
		p.addBooleanArg("-r", "Also search the reverse complement strand", false, false);
		p.addStringArg("-o", "Output table, or standard out if none is provided", false);
		try {
			p.parse(args);
		} catch(IllegalArgumentException e) {
			System.err.println(e.getMessage());
			System.exit(-1);
		}
		if(p.getBooleanArg("-d")) {
			logger.setLevel(Level.DEBUG);
		}

		MotifDatabase motifs = MotifDatabase.getDefault();
		List<String> motifNames = new ArrayList<String>(p.getStringListArg("-m"));
		if(p.hasValue("-mf")) {
			for(Motif m : motifs.readFromFile(p.getStringArg("-mf"))) {
				motifNames.add(m.getName());
			}
		}
		List<String> patterns = p.getStringListArg("-p");
		if(patterns.isEmpty() && motifNames.isEmpty()) {
			System.err.println("Provide at least one pattern (-p) or motif (-m, -mf)\n" + p.getHelpMessage());
			System.exit(-1);
		}

		List<Sequence> seqs = new ArrayList<Sequence>();
		if(p.hasValue("-s")) {
			seqs.add(new Sequence("input", "input", p.getStringArg("-s")));
		}
		if(p.hasValue("-f")) {
			seqs.addAll(FastaSequenceReader.loadAll(p.getStringArg("-f")));
		}
		if(seqs.isEmpty()) {
			System.err.println("Provide a sequence (-s) or a fasta file (-f)\n" + p.getHelpMessage());
			System.exit(-1);
		}

		PatternSearch search = create(patterns, motifNames, motifs, p.getBooleanArg("-r"));
		Writer writer = p.hasValue("-o") ? new BufferedWriter(new FileWriter(p.getStringArg("-o"))) : new BufferedWriter(new OutputStreamWriter(System.out));
		try {
			int numHits = search.writeHits(seqs, writer);
			logger.info("Found " + numHits + " hits in " + seqs.size() + " sequences");
		} finally {
			if(p.hasValue("-o")) {
				writer.close();
			} else {
				writer.flush();
			}
		}

		logger.info("");
		logger.info("All done.");

	}

}

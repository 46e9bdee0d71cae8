package dnascan.core.sequence;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.LineIterator;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

/**
 * Loads DNA sequences from fasta files
 * Records containing characters outside A, C, G, T, N are skipped with a warning
 */
public class FastaSequenceReader {

	static Logger logger = Logger.getLogger(FastaSequenceReader.class.getName());

	private FastaSequenceReader() {}

	/**
	 * Load all valid sequences from a fasta file
	 * @param fastaFile Fasta file
	 * @return Valid sequences in file order, with upper case bases
	 * @throws IOException
	 */
	public static List<Sequence> loadAll(String fastaFile) throws IOException {
		List<Sequence> rtrn = loadAll(new BufferedReader(new FileReader(new File(fastaFile))));
		logger.info("Loaded " + rtrn.size() + " sequences from " + fastaFile);
		return rtrn;
	}

	/**
	 * Load all valid sequences from a reader of fasta formatted text
	 * The reader is closed when done
	 * @param reader Reader
	 * @return Valid sequences in order, with upper case bases
	 * @throws IOException
	 */
	public static List<Sequence> loadAll(Reader reader) throws IOException {
		List<Sequence> rtrn = new ArrayList<Sequence>();
		LineIterator iter = new LineIterator(reader);
		try {
			String header = null;
			StringBuilder bases = new StringBuilder();
			while(iter.hasNext()) {
				String line = iter.nextLine().trim();
				if(line.isEmpty() || line.startsWith(";")) {
					continue;
				}
				if(line.startsWith(">")) {
					if(header != null) {
						addIfValid(rtrn, header, bases.toString());
					}
					header = line.substring(1).trim();
					bases.setLength(0);
					continue;
				}
				if(header == null) {
					throw new IOException("Fasta data does not start with a header line: " + line);
				}
				bases.append(line);
			}
			if(header != null) {
				addIfValid(rtrn, header, bases.toString());
			}
		} catch(IllegalStateException e) {
			// LineIterator wraps read failures
			throw new IOException(e.getMessage(), e.getCause());
		} finally {
			iter.close();
		}
		return rtrn;
	}

	private static void addIfValid(List<Sequence> sequences, String header, String rawBases) {
		String id = StringUtils.substringBefore(header, " ");
		String bases = StringUtils.deleteWhitespace(rawBases).toUpperCase();
		if(!SequenceUtils.isValid(bases)) {
			logger.warn("Skipping " + id + ": contains invalid characters");
			return;
		}
		sequences.add(new Sequence(id, header, bases));
	}

}

package dnascan.core.parser;

import java.util.Arrays;

import junit.framework.TestCase;

public class CommandLineParserTest extends TestCase {

	private static CommandLineParser parser() {
		CommandLineParser p = new CommandLineParser();
		p.setProgramDescription("Test program");
		p.addStringArg("-s", "Sequence", false);
		p.addStringArg("-o", "Output", false, "out.txt");
		p.addStringListArg("-p", "Patterns", false);
		p.addIntArg("-n", "Count", false, 3);
		p.addDoubleArg("-r2", "Threshold", false, 0.95);
		p.addBooleanArg("-d", "Debug", false, false);
		return p;
	}

	public void testDefaults() {
		CommandLineParser p = parser();
		p.parse(new String[0]);
		assertFalse(p.hasValue("-s"));
		assertNull(p.getStringArg("-s"));
		assertEquals("out.txt", p.getStringArg("-o"));
		assertTrue(p.getStringListArg("-p").isEmpty());
		assertEquals(3, p.getIntArg("-n"));
		assertEquals(0.95, p.getDoubleArg("-r2"), 0);
		assertFalse(p.getBooleanArg("-d"));
	}

	public void testValues() {
		CommandLineParser p = parser();
		p.parse(new String[] {"-s", "ACGT", "-p", "GAATTC, GGATCC,,", "-n", "7", "-r2", "0.5", "-d", "true"});
		assertTrue(p.hasValue("-s"));
		assertEquals("ACGT", p.getStringArg("-s"));
		assertEquals(Arrays.asList("GAATTC", "GGATCC"), p.getStringListArg("-p"));
		assertEquals(7, p.getIntArg("-n"));
		assertEquals(0.5, p.getDoubleArg("-r2"), 0);
		assertTrue(p.getBooleanArg("-d"));
	}

	public void testRequired() {
		CommandLineParser p = new CommandLineParser();
		p.addStringArg("-f", "Fasta file", true);
		try {
			p.parse(new String[0]);
			fail("Expected IllegalArgumentException");
		} catch(IllegalArgumentException e) {
			assertTrue(e.getMessage().contains("-f"));
			assertTrue(e.getMessage().contains("Fasta file"));
		}
	}

	public void testMalformedCommandLines() {
		String[][] bad = {{"-x", "1"}, {"-s"}, {"-s", "-n"}, {"-s", "A", "-s", "C"}};
		for(String[] args : bad) {
			try {
				parser().parse(args);
				fail("Expected IllegalArgumentException for " + Arrays.toString(args));
			} catch(IllegalArgumentException e) {
				// expected
			}
		}
	}

	public void testBadNumber() {
		CommandLineParser p = parser();
		p.parse(new String[] {"-n", "seven"});
		try {
			p.getIntArg("-n");
			fail("Expected IllegalArgumentException");
		} catch(IllegalArgumentException e) {
			// expected
		}
	}

	public void testWrongType() {
		CommandLineParser p = parser();
		p.parse(new String[0]);
		try {
			p.getIntArg("-s");
			fail("Expected IllegalArgumentException");
		} catch(IllegalArgumentException e) {
			// expected
		}
	}

	public void testQueryBeforeParse() {
		try {
			parser().getStringArg("-s");
			fail("Expected IllegalStateException");
		} catch(IllegalStateException e) {
			// expected
		}
	}

	public void testDuplicateDeclaration() {
		CommandLineParser p = parser();
		try {
			p.addStringArg("-s", "Another", false);
			fail("Expected IllegalArgumentException");
		} catch(IllegalArgumentException e) {
			// expected
		}
		try {
			p.addStringArg("-x", "Sequence", false);
			fail("Expected IllegalArgumentException");
		} catch(IllegalArgumentException e) {
			// expected
		}
	}

	public void testHelpMessage() {
		String help = parser().getHelpMessage();
		assertTrue(help.contains("Test program"));
		assertTrue(help.contains("-n <int>\tCount (default=3)"));
		assertTrue(help.indexOf("-d <boolean>") < help.indexOf("-s <String>"));
	}

}

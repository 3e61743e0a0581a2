package org.metricshub.jbones;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.BufferedReader;
import java.io.File;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Test;
import org.metricshub.jbones.frontend.LexerException;
import org.metricshub.jbones.util.JbonesSettings;
import org.metricshub.jbones.util.ScriptFileSource;

public class ScriptFileSourceTest {

	@Test
	public void pathIsTheDescription() throws Exception {
		Path file = Files.createTempFile("jbones", ".bb");
		try {
			Files.write(file, "incr é\n".getBytes(StandardCharsets.UTF_8));
			ScriptFileSource source = new ScriptFileSource(file.toString());
			assertEquals(file.toString(), source.getDescription());
			try (BufferedReader reader = new BufferedReader(source.getReader())) {
				assertEquals("incr é", reader.readLine());
			}
		} finally {
			Files.delete(file);
		}
	}

	@Test
	public void errorsNameTheFile() throws Exception {
		Path file = Files.createTempFile("jbones", ".bb");
		try {
			Files.write(file, "incr x\nwhile x\n".getBytes(StandardCharsets.UTF_8));
			LexerException e = assertThrows(
					LexerException.class,
					() -> new Jbones().compile(new ScriptFileSource(file.toString()), new JbonesSettings()));
			assertTrue(e.getMessage(), e.getMessage().contains(file.toString()));
		} finally {
			Files.delete(file);
		}
	}

	@Test
	public void missingFileFailsOnFirstRead() {
		ScriptFileSource source = new ScriptFileSource(new File("no-such-program.bb").getAbsolutePath());
		assertThrows(UncheckedIOException.class, source::getReader);
	}
}

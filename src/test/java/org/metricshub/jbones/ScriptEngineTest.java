package org.metricshub.jbones;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertThrows;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.script.Bindings;
import javax.script.ScriptEngine;
import javax.script.ScriptEngineManager;
import javax.script.ScriptException;
import org.junit.Test;
import org.metricshub.jbones.jsr223.JbonesScriptEngine;

public class ScriptEngineTest {

	@Test
	public void testJbonesScriptEngine() throws Exception {
		ScriptEngineManager manager = new ScriptEngineManager();
		ScriptEngine engine = manager.getEngineByName("jbones");
		assertNotNull("Jbones ScriptEngine not found", engine);

		Map<String, Long> inputs = new LinkedHashMap<String, Long>();
		inputs.put("x", 2L);
		inputs.put("y", 3L);
		Bindings bindings = engine.createBindings();
		bindings.put(JbonesScriptEngine.INPUTS_ATTRIBUTE, inputs);

		StringWriter result = new StringWriter();
		engine.getContext().setWriter(new PrintWriter(result));

		Object returned = engine.eval("while y not 0 do incr x; decr y end", bindings);

		assertEquals("y: 0\nx: 5\n", result.toString());
		assertEquals(result.toString(), returned);
	}

	@Test
	public void engineIsFoundByExtension() throws Exception {
		ScriptEngine engine = new ScriptEngineManager().getEngineByExtension("bb");
		assertNotNull("Jbones ScriptEngine not found", engine);
		assertEquals("c: 1\n", engine.eval("incr c"));
	}

	@Test
	public void outputStatementOnlyReferencesTheVariable() throws Exception {
		ScriptEngine engine = new ScriptEngineManager().getEngineByName("jbones");
		String program = engine.getFactory().getProgram("incr v", engine.getFactory().getOutputStatement("v"));
		assertEquals("v: 1\n", engine.eval(program));
	}

	@Test
	public void errorsBecomeScriptExceptions() {
		ScriptEngine engine = new ScriptEngineManager().getEngineByName("jbones");
		assertThrows(ScriptException.class, () -> engine.eval("end"));
	}
}

package org.metricshub.jbones.jsr223;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jbones
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import javax.script.AbstractScriptEngine;
import javax.script.Bindings;
import javax.script.ScriptContext;
import javax.script.ScriptEngineFactory;
import javax.script.ScriptException;
import javax.script.SimpleBindings;
import org.metricshub.jbones.Jbones;
import org.metricshub.jbones.util.JbonesSettings;
import org.metricshub.jbones.util.ScriptSource;

/**
 * Simple JSR-223 script engine for Jbones.
 * <p>
 * {@code eval} runs the program in process and returns its reported lines.
 * Runtime inputs are read from the {@value #INPUTS_ATTRIBUTE} attribute, a
 * map from variable name to initial value.
 */
public class JbonesScriptEngine extends AbstractScriptEngine {

	/** Attribute holding the initial values of the runtime inputs. */
	public static final String INPUTS_ATTRIBUTE = "inputs";

	private final ScriptEngineFactory factory;

	public JbonesScriptEngine(ScriptEngineFactory factory) {
		this.factory = factory;
	}

	@Override
	public Object eval(Reader scriptReader, ScriptContext context) throws ScriptException {
		try {
			JbonesSettings settings = new JbonesSettings();
			Object inputs = context.getAttribute(INPUTS_ATTRIBUTE);
			if (inputs instanceof Map) {
				for (Map.Entry<?, ?> input : ((Map<?, ?>) inputs).entrySet()) {
					String name = String.valueOf(input.getKey());
					settings.addInputName(name);
					settings.putInputValue(name, new BigInteger(String.valueOf(input.getValue())));
				}
			}
			ByteArrayOutputStream result = new ByteArrayOutputStream();
			settings.setOutputStream(new PrintStream(result, false, StandardCharsets.UTF_8.name()));
			Jbones jbones = new Jbones();
			jbones.invoke(new ScriptSource(ScriptSource.DESCRIPTION_INLINE_SCRIPT, scriptReader), settings);
			settings.getOutputStream().flush();
			String out = result.toString(StandardCharsets.UTF_8.name());
			Writer writer = context.getWriter();
			if (writer != null) {
				writer.write(out);
				writer.flush();
			}
			return out;
		} catch (Exception e) {
			throw new ScriptException(e);
		}
	}

	@Override
	public Object eval(String script, ScriptContext context) throws ScriptException {
		return eval(new StringReader(script), context);
	}

	@Override
	public Bindings createBindings() {
		return new SimpleBindings();
	}

	@Override
	public ScriptEngineFactory getFactory() {
		return factory;
	}
}

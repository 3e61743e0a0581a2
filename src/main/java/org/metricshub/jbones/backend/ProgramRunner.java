package org.metricshub.jbones.backend;

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

import java.io.IOException;
import java.math.BigInteger;
import java.util.List;
import org.metricshub.jbones.intermediate.SsaFunction;

/**
 * Executes a finished {@link SsaFunction}.
 */
public interface ProgramRunner {
	/**
	 * Run the function to completion. Reported values are written to the
	 * output stream the runner was configured with.
	 *
	 * @param function a sealed function
	 * @param arguments one value per function parameter, in parameter order
	 * @return execution time in nanoseconds
	 * @throws IOException in case of I/O problems
	 */
	long run(SsaFunction function, List<BigInteger> arguments) throws IOException;
}

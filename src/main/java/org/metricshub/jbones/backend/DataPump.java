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
import java.io.InputStream;
import java.io.OutputStream;
import org.metricshub.jbones.util.JbonesLogger;
import org.slf4j.Logger;

/**
 * Relays the data of a child process stream to another stream, in its own
 * thread, until end of stream.
 */
final class DataPump implements Runnable {

	private static final Logger LOG = JbonesLogger.getLogger(DataPump.class);

	private final String description;
	private final InputStream in;
	private final OutputStream out;
	private final Thread thread;

	private DataPump(String description, InputStream in, OutputStream out) {
		this.description = description;
		this.in = in;
		this.out = out;
		this.thread = new Thread(this, "DataPump: " + description);
		this.thread.setDaemon(true);
	}

	/**
	 * Starts relaying {@code in} to {@code out}.
	 *
	 * @param description name of the process, for the thread name and logs
	 * @param in stream of the child process
	 * @param out destination, flushed but not closed
	 * @return the running pump
	 */
	static DataPump dump(String description, InputStream in, OutputStream out) {
		DataPump pump = new DataPump(description, in, out);
		pump.thread.start();
		return pump;
	}

	/** {@inheritDoc} */
	@Override
	public void run() {
		byte[] buffer = new byte[4096];
		try {
			int count;
			while ((count = in.read(buffer)) != -1) {
				out.write(buffer, 0, count);
			}
			out.flush();
		} catch (IOException e) {
			LOG.warn("Failed to relay the output of {}: {}", description, e.getMessage());
		} finally {
			try {
				in.close();
			} catch (IOException e) {
				LOG.debug("Failed to close the stream of {}", description, e);
			}
		}
	}

	/**
	 * Waits until everything has been relayed.
	 *
	 * @throws InterruptedException if interrupted while waiting
	 */
	void join() throws InterruptedException {
		thread.join();
	}
}

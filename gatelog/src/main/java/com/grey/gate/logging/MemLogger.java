/*
 * Copyright 2012-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.logging;

import com.grey.gate.base.config.SysProps;

/**
 * Accumulates log messages as an in-memory string.
 * Synchronised, so that tests can inspect the log of a server whose workers run on other threads.
 */
public class MemLogger
	extends Logger
{
	private static final String eolstr = SysProps.EOL;
	private final StringBuilder logbuf = new StringBuilder();
	private final StringBuilder msgbuf = new StringBuilder();  //preallocated for efficiency

	public synchronized String get() {return logbuf.toString();}
	public synchronized int length() {return logbuf.length();}
	public synchronized void reset() {logbuf.setLength(0);}

	public MemLogger(String logname)
	{
		this(new Parameters.Builder().withLogClass(MemLogger.class).withQuietMode(true).build(), logname);
	}

	protected MemLogger(Parameters params, String logname)
	{
		super(adjust(params), logname, true);
	}

	// Doesn't actually close, just discards contents and capacity.
	// Users can continue to call log()
	@Override
	protected synchronized void closeStream(boolean is_owner)
	{
		reset();
		logbuf.trimToSize();
	}

	@Override
	public synchronized void log(LEVEL lvl, CharSequence msg)
	{
		if (!isActive(lvl)) return;
		try {
			setLogEntry(lvl, msgbuf);
		} catch (java.io.IOException ex) {
			//can't actually happen, as setLogEntry() won't do any I/O for this logger
			throw new IllegalStateException("MemLogger failed to prepare log entry", ex);
		}
		logbuf.append(msgbuf).append(msg).append(eolstr);
	}

	// remove settings that make no sense for this logger
	private static Parameters adjust(Parameters params)
	{
		Parameters.Builder bldr = new Parameters.Builder(params);
		return bldr
				.withPathname(null)
				.withStream(null)
				.withBufferSize(0)
				.withFlushInterval(0)
				.build();
	}
}

/*
 * Copyright 2010-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.logging;

import com.grey.gate.base.ExceptionUtils;
import com.grey.gate.base.config.SysProps;

/**
 * This logger writes out the log message as is, to either a stream or a file.
 * <br>
 * It is not MT-safe, see MTCharLogger.
 */
public class CharLogger
	extends Logger
{
	private static final String eolstr = SysProps.EOL;

	private final StringBuilder logmsg_buf = new StringBuilder();
	private java.io.Writer logstrm;

	protected CharLogger(Parameters params, String logname)
	{
		this(params, logname, false);
	}

	protected CharLogger(Parameters params, String logname, boolean is_mt)
	{
		super(params, logname, is_mt);
	}

	@Override
	protected void openStream(java.io.OutputStream strm)
	{
		java.io.Writer w = new java.io.OutputStreamWriter(strm, java.nio.charset.StandardCharsets.UTF_8);
		logstrm = (bufsiz == 0 ? w : new java.io.BufferedWriter(w, bufsiz));
	}

	@Override
	protected void openStream(String pthnam) throws java.io.IOException
	{
		java.io.FileOutputStream fstrm = new java.io.FileOutputStream(pthnam, true);
		openStream(fstrm);
	}

	@Override
	protected void closeStream(boolean is_owner) throws java.io.IOException
	{
		if (logstrm != null) {
			java.io.Writer strm = logstrm;
			logstrm = null;
			if (is_owner) {
				strm.close();
			} else {
				strm.flush();
			}
		}
	}

	@Override
	public void flush() throws java.io.IOException
	{
		if (logstrm != null) logstrm.flush();
	}

	@Override
	public void log(LEVEL lvl, CharSequence msg)
	{
		if (!isActive(lvl)) return;
		if (logstrm == null) return; //closed

		try {
			setLogEntry(lvl, logmsg_buf);
			logmsg_buf.append(msg).append(eolstr);
			logstrm.append(logmsg_buf);
			if (bufsiz == 0) logstrm.flush();
		} catch (java.io.IOException ex) {
			System.out.println(new java.util.Date(System.currentTimeMillis())+" ERROR: Failed to write log="+getName()+" - "
					+ExceptionUtils.summary(ex, false)+" - Message="+msg);
		}
	}
}

/*
 * Copyright 2010-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.base;

import com.grey.gate.base.config.SysProps;

public class ExceptionUtils
{
	public static String summary(Throwable ex)
	{
		return summary(ex, false);
	}

	public static String summary(Throwable ex, boolean withstack)
	{
		StringBuilder strbuf = new StringBuilder(128);

		if (withstack) {
			java.io.StringWriter sw = new java.io.StringWriter();
			java.io.PrintWriter pw = new java.io.PrintWriter(sw, false);
			ex.printStackTrace(pw);
			pw.close();
			strbuf.append(sw);
		} else {
			int level = 1;
			while (ex != null) {
				if (level != 1) strbuf.append(SysProps.EOL).append("\tCaused by: ");
				strbuf.append("Exception-").append(level++).append('=').append(ex.toString());
				ex = ex.getCause();
			}
		}
		return strbuf.toString();
	}

	/**
	 * Walks the cause chain looking for an exception of the given type (or a subclass of it).
	 */
	public static Throwable getCause(Throwable ex, Class<? extends Throwable> clss)
	{
		while (ex != null) {
			if (clss.isAssignableFrom(ex.getClass())) return ex;
			ex = ex.getCause();
		}
		return null;
	}

	// interrupts are sometimes wrapped in I/O exceptions by the NIO layer
	public static boolean isInterrupt(Throwable ex)
	{
		return getCause(ex, InterruptedException.class) != null
				|| getCause(ex, java.nio.channels.ClosedByInterruptException.class) != null;
	}
}

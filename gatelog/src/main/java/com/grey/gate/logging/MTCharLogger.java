/*
 * Copyright 2010-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.logging;

/** MT-safe wrapper around its non-MT parent.
 * This is the default logger class, as a server running pre-forked workers shares one logger between its worker threads.
 */
public class MTCharLogger
	extends CharLogger
{
	protected MTCharLogger(Parameters params, String logname)
	{
		super(params, logname, true);
	}

	@Override
	synchronized public void flush() throws java.io.IOException
	{
		super.flush();
	}

	@Override
	public void log(LEVEL lvl, CharSequence msg)
	{
		if (!isActive(lvl)) return;
		synchronized (this) {super.log(lvl, msg);}
	}
}

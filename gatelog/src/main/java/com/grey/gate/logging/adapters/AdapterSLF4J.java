/*
 * Copyright 2010-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.logging.adapters;

import com.grey.gate.logging.Interop;
import com.grey.gate.logging.Parameters;

/**
 * Bridges to whatever SLF4J binding is on the classpath.
 * The effective level is the more restrictive of the configured level and the level enabled in the SLF4J logger.
 */
public class AdapterSLF4J
	extends com.grey.gate.logging.Logger
{
	private final org.slf4j.Logger extlog;  //the external logger we're bridging to

	public AdapterSLF4J(Parameters params, String logname)
	{
		super(adjust(params), logname, false);
		extlog = org.slf4j.LoggerFactory.getLogger("greygate."+logname);
	}

	public org.slf4j.Logger getExternalLogger() {return extlog;}

	@Override
	public boolean isActive(LEVEL lvl)
	{
		return super.isActive(lvl) && Interop.isActive(Interop.getLevel(extlog), lvl);
	}

	@Override
	public void log(LEVEL lvl, CharSequence logmsg)
	{
		if (!isActive(lvl)) return;
		String msg = logmsg.toString();

		switch (lvl)
		{
			case ERR:
				extlog.error(msg);
				break;
			case WARN:
				extlog.warn(msg);
				break;
			case INFO:
			case ALL:
				extlog.info(msg);
				break;
			case TRC:
				extlog.debug(msg);
				break;
			default:
				extlog.trace(msg);
				break;
		}
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
				.withQuietMode(true)
				.build();
	}
}

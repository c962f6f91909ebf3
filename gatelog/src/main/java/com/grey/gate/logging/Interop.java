/*
 * Copyright 2011-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.logging;

import com.grey.gate.logging.Logger.LEVEL;

public class Interop
{
	public static boolean isActive(LEVEL logger, LEVEL msg)
	{
		if (logger == LEVEL.OFF || msg == LEVEL.OFF) return false;
		if (logger == LEVEL.ALL || msg == LEVEL.ALL) return true;  //msg=ALL doesn't really make sense, but pass it
		return (msg.ordinal() <= logger.ordinal());
	}

	public static LEVEL getLevel(org.slf4j.Logger log)
	{
		if (log.isTraceEnabled()) return LEVEL.ALL;
		if (log.isDebugEnabled()) return LEVEL.TRC;
		if (log.isInfoEnabled()) return LEVEL.INFO;
		if (log.isWarnEnabled()) return LEVEL.WARN;
		if (log.isErrorEnabled()) return LEVEL.ERR;
		return LEVEL.OFF;
	}
}

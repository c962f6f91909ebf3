/*
 * Copyright 2011-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.logging;

import com.grey.gate.base.config.SysProps;
import com.grey.gate.base.config.XmlConfig;
import com.grey.gate.base.utils.TimeOps;

public class Parameters
{
	public static final String SYSPROP_LOGCLASS = "greygate.logger.class";
	public static final String SYSPROP_LOGLEVEL = "greygate.logger.level";
	public static final String SYSPROP_LOGSDIR = "greygate.logger.dir";
	public static final String SYSPROP_LOGFILE = "greygate.logger.file";
	public static final String SYSPROP_FORCE_STDOUT = "greygate.logger.stdout";
	public static final String SYSPROP_BUFSIZ = "greygate.logger.bufsiz";
	public static final String SYSPROP_FLUSHINTERVAL = "greygate.logger.flushinterval";
	public static final String SYSPROP_SHOWPID = "greygate.logger.pid";
	public static final String SYSPROP_SHOWTID = "greygate.logger.tid";
	public static final String SYSPROP_SHOWTHRDNAME = "greygate.logger.threadname";

	public static final long CURRENT_PID = ProcessHandle.current().pid();

	public static final String TOKEN_LOGSDIR = "%DIRLOG%";
	public static final String TOKEN_PID = "%PID%";

	private static final Class<?> DFLTCLASS = MTCharLogger.class;  //safe option for naive/unaware apps
	private static final java.io.OutputStream DFLT_STRM = System.out;
	private static final String PTHNAM_STDOUT = "%stdout%";
	private static final String PTHNAM_STDERR = "%stderr%";

	private final String logClass;
	private final Logger.LEVEL logLevel;
	private final String pthnam;
	private final java.io.OutputStream strm;
	private final int bufSize;
	private final long flushInterval;
	private final boolean withPID;
	private final boolean withTID;
	private final boolean withThreadName;
	private final boolean quietMode;

	private Parameters(Builder bldr) {
		logClass = bldr.logClass;
		logLevel = bldr.logLevel;
		pthnam = bldr.pthnam;
		strm = bldr.strm;
		bufSize = bldr.bufSize;
		flushInterval = bldr.flushInterval;
		withPID = bldr.withPID;
		withTID = bldr.withTID;
		withThreadName = bldr.withThreadName;
		quietMode = bldr.quietMode;
	}

	public Parameters(XmlConfig cfg) {
		this(Builder.fromConfig(cfg));
	}

	public String getLogClass() {
		return logClass;
	}

	public Logger.LEVEL getLogLevel() {
		return logLevel;
	}

	public String getPathname() {
		return pthnam;
	}

	public java.io.OutputStream getStream() {
		return strm;
	}

	public int getBufSize() {
		return bufSize;
	}

	public long getFlushInterval() {
		return flushInterval;
	}

	public boolean withPID() {
		return withPID;
	}

	public boolean withTID() {
		return withTID;
	}

	public boolean withThreadName() {
		return withThreadName;
	}

	public boolean isQuietMode() {
		return quietMode;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder(getClass().getSimpleName());
		sb.append("[Level=").append(logLevel);
		sb.append(", Dest=");
		if (getPathname() != null) {
			sb.append(getPathname());
		} else if (getStream() == System.out) {
			sb.append("stdout");
		} else if (getStream() == System.err) {
			sb.append("stderr");
		} else if (getStream() == null) {
			sb.append("SINK");
		} else {
			sb.append(getStream());
		}
		sb.append(" Type=").append(getLogClass());
		if (getBufSize() != 0) {
			sb.append(" Buffer=").append(getBufSize()).append('/');
			TimeOps.expandMilliTime(getFlushInterval(), sb, false);
		}
		sb.append("]");
		return sb.toString();
	}


	public static class Builder {
		private String logClass = SysProps.get(SYSPROP_LOGCLASS, DFLTCLASS.getName());
		private Logger.LEVEL logLevel = Logger.LEVEL.valueOf(SysProps.get(SYSPROP_LOGLEVEL, Logger.LEVEL.INFO.name()).toUpperCase());
		private String pthnam = SysProps.get(SYSPROP_LOGFILE);
		private java.io.OutputStream strm = DFLT_STRM;
		private int bufSize = SysProps.get(SYSPROP_BUFSIZ, 8 * 1024);
		private long flushInterval = SysProps.getTime(SYSPROP_FLUSHINTERVAL, 1_000L);
		private boolean withPID = SysProps.get(SYSPROP_SHOWPID, false);
		private boolean withTID = SysProps.get(SYSPROP_SHOWTID, true);
		private boolean withThreadName = SysProps.get(SYSPROP_SHOWTHRDNAME, false);
		private boolean quietMode;

		public Builder() {}

		public Builder(Parameters params) {
			logClass = params.getLogClass();
			logLevel = params.getLogLevel();
			pthnam = params.getPathname();
			strm = params.getStream();
			bufSize = params.getBufSize();
			flushInterval = params.getFlushInterval();
			withPID = params.withPID();
			withTID = params.withTID();
			withThreadName = params.withThreadName();
			quietMode = params.isQuietMode();
		}

		public Builder withLogClass(String v) {
			logClass = v;
			return this;
		}

		public Builder withLogClass(Class<?> v) {
			return withLogClass(v.getName());
		}

		public Builder withLogLevel(Logger.LEVEL v) {
			logLevel = v;
			return this;
		}

		public Builder withPathname(String v) {
			pthnam = v;
			return this;
		}

		public Builder withStream(java.io.OutputStream v) {
			strm = v;
			return this;
		}

		public Builder withBufferSize(int v) {
			bufSize = v;
			return this;
		}

		public Builder withFlushInterval(long v) {
			flushInterval = v;
			return this;
		}

		public Builder withPID(boolean v) {
			withPID = v;
			return this;
		}

		public Builder withTID(boolean v) {
			withTID = v;
			return this;
		}

		public Builder withThreadName(boolean v) {
			withThreadName = v;
			return this;
		}

		public Builder withQuietMode(boolean v) {
			quietMode = v;
			return this;
		}

		private Builder reconcile()
		{
			if (SysProps.get(SYSPROP_FORCE_STDOUT, false)) {
				strm = System.out;
				pthnam = null;
			}

			if (pthnam != null) {
				if (pthnam.equalsIgnoreCase(PTHNAM_STDOUT)) {
					strm = System.out;
				} else if (pthnam.equalsIgnoreCase(PTHNAM_STDERR)) {
					strm = System.err;
				} else {
					// it's an actual pathname, which overrides the strm field
					strm = null;
				}
				if (strm != null) pthnam = null;
			}

			if (pthnam != null) {
				pthnam = pthnam.replace(TOKEN_LOGSDIR, SysProps.get(SYSPROP_LOGSDIR, "."));
				pthnam = pthnam.replace(SysProps.DIRTOKEN_TMP, SysProps.TMPDIR);
				pthnam = pthnam.replace(TOKEN_PID, String.valueOf(CURRENT_PID));
				try {
					pthnam = new java.io.File(pthnam).getCanonicalPath();
				} catch (java.io.IOException ex) {
					throw new IllegalArgumentException("Failed to canonise logfile="+pthnam, ex);
				}
			}
			if (bufSize == 0) flushInterval = 0;
			return this;
		}

		public Parameters build() {
			reconcile();
			return new Parameters(this);
		}

		private static Builder fromConfig(XmlConfig cfg) {
			Builder bldr = new Builder();
			if (cfg == null || !cfg.exists()) {
				return bldr.reconcile();
			}
			bldr.logClass = cfg.getValue("@class", false, bldr.logClass);
			bldr.logLevel = Logger.LEVEL.valueOf(cfg.getValue("@level", false, bldr.logLevel.name()).toUpperCase());
			bldr.pthnam = cfg.getValue(".", false, bldr.pthnam);
			bldr.bufSize = cfg.getInt("@buffer", false, bldr.bufSize);
			bldr.flushInterval = cfg.getTime("@flush", bldr.flushInterval);
			bldr.withPID = cfg.getBool("@pid", bldr.withPID);
			bldr.withTID = cfg.getBool("@tid", bldr.withTID);
			bldr.withThreadName = cfg.getBool("@tname", bldr.withThreadName);
			bldr.quietMode = cfg.getBool("@quiet", bldr.quietMode);
			return bldr.reconcile();
		}
	}
}

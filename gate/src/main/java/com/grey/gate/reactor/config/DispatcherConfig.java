/*
 * Copyright 2012-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.reactor.config;

import com.grey.gate.base.config.SysProps;
import com.grey.gate.base.config.XmlConfig;
import com.grey.gate.logging.Logger;
import com.grey.gate.logging.SinkLogger;

public class DispatcherConfig
{
	public static final String SYSPROP_LOGNAME = "greygate.dispatchers.logname";

	private final String name;
	private final String logName;
	private final Logger logger;

	private DispatcherConfig(Builder bldr) {
		name = bldr.name;
		logName = (bldr.logName == null ? SysProps.get(SYSPROP_LOGNAME, name) : bldr.logName);
		logger = (bldr.logger == null ? new SinkLogger(logName == null ? "dispatcher" : logName) : bldr.logger);
	}

	public String getName() {
		return name;
	}

	public String getLogName() {
		return logName;
	}

	public Logger getLogger() {
		return logger;
	}

	public static Builder builder() {
		return new Builder();
	}

	public Builder mutate() {
		return builder()
				.withName(name)
				.withLogName(logName)
				.withLogger(logger);
	}

	@Override
	public String toString() {
		return "DispatcherConfig[name=" + name
				+", logName=" + logName
				+", logger=" + logger + "]";
	}

	public static class Builder {
		private String name;
		private String logName;
		private Logger logger;

		public Builder() {}

		public Builder withXmlConfig(XmlConfig cfg) {
			name = cfg.getValue("@name", false, name);
			logName = cfg.getValue("@logname", false, logName == null ? name : logName);
			return this;
		}

		public Builder withName(String v) {
			name = v;
			return this;
		}

		public Builder withLogName(String v) {
			logName = v;
			return this;
		}

		// Null means discard all logging
		public Builder withLogger(Logger v) {
			logger = v;
			return this;
		}

		public DispatcherConfig build() {
			return new DispatcherConfig(this);
		}
	}
}

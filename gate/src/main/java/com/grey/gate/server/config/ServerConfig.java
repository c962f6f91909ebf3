/*
 * Copyright 2015-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.server.config;

import com.grey.gate.base.config.XmlConfig;
import com.grey.gate.base.utils.TimeOps;
import com.grey.gate.errors.GateConfigException;
import com.grey.gate.reactor.config.SSLConfig;

public class ServerConfig
{
	public static final int DFLT_MAX_CONS = 512;
	public static final int DFLT_MAX_CONS_PER_IP = 0;
	public static final int DFLT_BACKLOG = 100;

	private final String name;
	private final String iface;
	private final int port;
	private final int backlog;
	private final int maxConns; //zero means unlimited
	private final int maxConnsPerIP; //zero means unlimited
	private final int workers; //1 means inline, zero means one per processor
	private final long timeout; //event-loop wait, negative means indefinite
	private final SSLConfig configSSL;
	private final String factoryClass;
	private final XmlConfig factoryConfig;

	private ServerConfig(Builder bldr) {
		if (bldr.port < 0 || bldr.port > 0xFFFF) throw new GateConfigException("Invalid port="+bldr.port);
		if (bldr.backlog < 0) throw new GateConfigException("Invalid backlog="+bldr.backlog);
		if (bldr.maxConns < 0) throw new GateConfigException("Invalid maxconns="+bldr.maxConns);
		if (bldr.maxConnsPerIP < 0) throw new GateConfigException("Invalid maxconns_per_ip="+bldr.maxConnsPerIP);
		name = (bldr.name == null ? "server-"+bldr.port : bldr.name);
		iface = bldr.iface;
		port = bldr.port;
		backlog = bldr.backlog;
		maxConns = bldr.maxConns;
		maxConnsPerIP = bldr.maxConnsPerIP;
		workers = bldr.workers;
		timeout = bldr.timeout;
		configSSL = bldr.configSSL;
		factoryClass = bldr.factoryClass;
		factoryConfig = bldr.factoryConfig;
	}

	public String getName() {
		return name;
	}

	public String getInterface() {
		return iface;
	}

	public int getPort() {
		return port;
	}

	public int getBacklog() {
		return backlog;
	}

	public int getMaxConns() {
		return maxConns;
	}

	public int getMaxConnsPerIP() {
		return maxConnsPerIP;
	}

	public int getWorkers() {
		return workers;
	}

	public long getTimeout() {
		return timeout;
	}

	public SSLConfig getConfigSSL() {
		return configSSL;
	}

	public String getFactoryClass() {
		return factoryClass;
	}

	public XmlConfig getFactoryConfig() {
		return factoryConfig;
	}

	public static Builder builder() {
		return new Builder();
	}

	public Builder mutate() {
		return builder()
				.withName(name)
				.withInterface(iface)
				.withPort(port)
				.withBacklog(backlog)
				.withMaxConns(maxConns)
				.withMaxConnsPerIP(maxConnsPerIP)
				.withWorkers(workers)
				.withTimeout(timeout)
				.withConfigSSL(configSSL)
				.withFactory(factoryClass, factoryConfig);
	}

	@Override
	public String toString() {
		return "ServerConfig[name=" + name
				+", interface=" + iface
				+", port=" + port
				+", backlog=" + backlog
				+", maxconns=" + maxConns
				+", maxconns_per_ip=" + maxConnsPerIP
				+", workers=" + workers
				+", timeout=" + timeout
				+", factory=" + factoryClass
				+", ssl=" + (configSSL != null) + "]";
	}

	public static class Builder {
		private String name;
		private String iface;
		private int port;
		private int backlog = DFLT_BACKLOG;
		private int maxConns = DFLT_MAX_CONS;
		private int maxConnsPerIP = DFLT_MAX_CONS_PER_IP;
		private int workers = 1;
		private long timeout = -1;
		private SSLConfig configSSL;
		private String factoryClass;
		private XmlConfig factoryConfig;

		public Builder() {}

		// Call the other setter methods before this to set any defaults
		public Builder withXmlConfig(XmlConfig cfg) {
			name = cfg.getValue("@name", false, name);
			iface = cfg.getValue("@interface", false, iface);
			port = cfg.getInt("@port", false, port);
			backlog = cfg.getInt("@backlog", false, backlog);
			maxConns = cfg.getInt("@maxconns", false, maxConns);
			maxConnsPerIP = cfg.getInt("@maxconns_per_ip", false, maxConnsPerIP);
			workers = cfg.getInt("@workers", false, workers);

			String tmt = cfg.getValue("@timeout", false, null);
			if (tmt != null) {
				try {
					timeout = TimeOps.parseMilliTime(tmt);
				} catch (NumberFormatException ex) {
					throw new GateConfigException("Invalid server timeout="+tmt, ex);
				}
			}

			XmlConfig fcfg = cfg.getSection("factory");
			if (fcfg.exists()) {
				factoryClass = fcfg.getValue("@class", false, factoryClass); //launchers may supply their own factory
				factoryConfig = fcfg;
			}

			XmlConfig xmlSSL = cfg.getSection("ssl");
			if (xmlSSL.exists()) {
				try {
					configSSL = new SSLConfig.Builder()
							.withXmlConfig(xmlSSL)
							.build();
				} catch (GateConfigException ex) {
					throw ex;
				} catch (Exception ex) {
					throw new GateConfigException("Failed to configure SSL", ex);
				}
			}
			return this;
		}

		public Builder withName(String v) {
			name = v;
			return this;
		}

		public Builder withInterface(String v) {
			iface = v;
			return this;
		}

		public Builder withPort(int v) {
			port = v;
			return this;
		}

		public Builder withBacklog(int v) {
			backlog = v;
			return this;
		}

		public Builder withMaxConns(int v) {
			maxConns = v;
			return this;
		}

		public Builder withMaxConnsPerIP(int v) {
			maxConnsPerIP = v;
			return this;
		}

		public Builder withWorkers(int v) {
			workers = v;
			return this;
		}

		public Builder withTimeout(long v) {
			timeout = v;
			return this;
		}

		public Builder withConfigSSL(SSLConfig v) {
			configSSL = v;
			return this;
		}

		// The class is only recorded here, and gets instantiated by whoever launches the server
		public Builder withFactory(String clss, XmlConfig cfg) {
			factoryClass = clss;
			factoryConfig = cfg;
			return this;
		}

		public ServerConfig build() {
			return new ServerConfig(this);
		}
	}
}

/*
 * Copyright 2010-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate;

import com.grey.gate.base.ExceptionUtils;
import com.grey.gate.base.config.XmlConfig;
import com.grey.gate.base.utils.CommandParser;
import com.grey.gate.base.utils.DynLoader;
import com.grey.gate.errors.GateConfigException;
import com.grey.gate.reactor.Dispatcher;
import com.grey.gate.reactor.config.DispatcherConfig;
import com.grey.gate.server.GateServer;
import com.grey.gate.server.HandlerFactory;
import com.grey.gate.server.config.ServerConfig;
import com.grey.gate.logging.Factory;
import com.grey.gate.logging.Logger;
import com.grey.gate.logging.Logger.LEVEL;

/**
 * Launches a server driven by command-line options and, typically, a gate.xml style config file:
 * <pre>
 * &lt;gate&gt;
 *   &lt;dispatcher name="..." logname="..."/&gt;
 *   &lt;server port="..." ...&gt;&lt;factory class="..."/&gt;&lt;/server&gt;
 * &lt;/gate&gt;
 * </pre>
 * Applications which supply their own handler factory rather than naming one in the config file would subclass this
 * and override createHandlerFactory().
 */
public class Launcher
{
	static final String[] options = new String[]{"c:", "port:", "workers:", "logger:"};

	protected final BaseOptsHandler baseOptions = new BaseOptsHandler();
	protected final CommandParser cmdParser;
	protected final String[] cmdlineArgs;

	private volatile GateServer server;

	public GateServer getServer() {return server;}

	public static void main(String[] args) throws Exception {
		Launcher app = new Launcher(args);
		app.execute("gate");
	}

	public Launcher(String[] args) {
		this(args, false);
	}

	// silent mode suppresses usage messages on stdout, mainly for the benefit of the unit tests
	public Launcher(String[] args, boolean silent) {
		cmdlineArgs = args;
		cmdParser = new CommandParser(baseOptions, silent);
	}

	/**
	 * Creates the handler factory named in the config file. Subclasses can override this to supply a hardwired one.
	 * The factory class must have a public constructor which takes an XmlConfig, or else a no-arg one.
	 */
	protected HandlerFactory createHandlerFactory(ServerConfig cfg, Logger log) throws ReflectiveOperationException {
		if (cfg.getFactoryClass() == null) {
			throw new GateConfigException("Server="+cfg.getName()+" has no handler factory configured");
		}
		XmlConfig fcfg = (cfg.getFactoryConfig() == null ? XmlConfig.BLANKCFG : cfg.getFactoryConfig());
		log.info("Server="+cfg.getName()+": Creating handler factory="+cfg.getFactoryClass());
		return DynLoader.createInstance(cfg.getFactoryClass(), HandlerFactory.class, new Object[]{fcfg}, new Object[0]);
	}

	/**
	 * Supplies the config to use when no config file is specified on the command line. Null means run with the
	 * built-in defaults.
	 */
	protected XmlConfig getDefaultConfig() throws java.io.IOException {
		return null;
	}

	/**
	 * Parses the command line, loads the config and then serves until the server is shut down or interrupted.
	 * A failure to start up is reported in the log rather than thrown.
	 * @return False if the server could not be started, else true once it has finished serving
	 */
	public boolean execute(String dflt_name) throws java.io.IOException {
		int param1 = cmdParser.parse(cmdlineArgs);
		if (param1 == -1) return false;

		XmlConfig xmlcfg = loadConfigFile();
		if (xmlcfg == null) return false;

		DispatcherConfig.Builder bldrDispatcher = new DispatcherConfig.Builder().withName(dflt_name);
		XmlConfig dcfg = xmlcfg.getSection("dispatcher");
		if (dcfg.exists()) bldrDispatcher = bldrDispatcher.withXmlConfig(dcfg);
		DispatcherConfig dspcfg = bldrDispatcher.build();

		String logname = (baseOptions.logname == null ? dspcfg.getLogName() : baseOptions.logname);
		Logger log = (logname == null ? Factory.getLogger() : Factory.getLogger(logname));
		log.info("Launcher: Starting with options="+baseOptions+" and logger="+log.getClass().getName()+"/"+log.getName());
		dspcfg = dspcfg.mutate().withLogger(log).build();

		Dispatcher dsptch = null;
		try {
			ServerConfig srvcfg = buildServerConfig(xmlcfg, dflt_name);
			int workers = (baseOptions.workers == null ? srvcfg.getWorkers() : baseOptions.workers);
			HandlerFactory fact = createHandlerFactory(srvcfg, log);
			dsptch = Dispatcher.create(dspcfg);
			server = GateServer.create(dsptch, srvcfg, fact);
			server.serve(srvcfg.getTimeout(), true, true, workers);
		} catch (Exception ex) {
			boolean dumpStack = !(ex instanceof GateConfigException || ex instanceof java.io.IOException);
			log.log(LEVEL.ERR, ex, dumpStack, "Launcher: Failed to start server - "+ExceptionUtils.summary(ex));
			GateServer srv = server;
			if (srv != null) {
				srv.closeAll();
			} else if (dsptch != null) {
				dsptch.closeAll();
			}
			return false;
		} finally {
			log.flush();
		}
		log.info("Launcher: Server has stopped - "+server);
		log.flush();
		return true;
	}

	private ServerConfig buildServerConfig(XmlConfig xmlcfg, String dflt_name) {
		ServerConfig.Builder bldr = new ServerConfig.Builder().withName(dflt_name);
		XmlConfig scfg = xmlcfg.getSection("server");
		if (scfg.exists()) bldr = bldr.withXmlConfig(scfg);
		if (baseOptions.port != null) bldr = bldr.withPort(baseOptions.port);
		return bldr.build();
	}

	// returns null if the specified config file doesn't exist
	private XmlConfig loadConfigFile() throws java.io.IOException {
		if (baseOptions.cfgpath == null || baseOptions.cfgpath.isEmpty()) {
			XmlConfig cfg = getDefaultConfig();
			return (cfg == null ? XmlConfig.makeSection("<gate/>", "/gate") : cfg);
		}
		java.io.File fhConfig = new java.io.File(baseOptions.cfgpath);
		if (!fhConfig.exists()) {
			if (!cmdParser.isSilent()) System.out.println("Gate config file not found: "+baseOptions.cfgpath);
			return null;
		}
		return XmlConfig.getSection(fhConfig.getAbsolutePath(), "/gate");
	}


	public static class BaseOptsHandler
		extends CommandParser.OptionsHandler
	{
		public String cfgpath;
		public String logname;
		public Integer port;
		public Integer workers;

		public BaseOptsHandler() {super(options, 0, 0);}

		@Override
		public void setOption(String opt, String val) {
			if (opt.equals("c")) {
				cfgpath = val;
			} else if (opt.equals("port")) {
				port = Integer.valueOf(val);
			} else if (opt.equals("workers")) {
				workers = Integer.valueOf(val);
			} else if (opt.equals("logger")) {
				logname = val;
			} else {
				super.setOption(opt, val);
			}
		}

		@Override
		public String displayUsage() {
			return Launcher.displayUsage();
		}

		@Override
		public String toString() {
			return "cfgpath="+cfgpath+", port="+port+", workers="+workers+", logname="+logname;
		}
	}

	public static String displayUsage()
	{
		return "\t[-c gate-config-file] [-port n] [-workers n] [-logger name]";
	}
}

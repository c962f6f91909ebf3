/*
 * Copyright 2012-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.echo;

import org.slf4j.LoggerFactory;

import com.grey.gate.base.config.XmlConfig;
import com.grey.gate.base.utils.CommandParser;
import com.grey.gate.base.utils.DynLoader;
import com.grey.gate.server.HandlerFactory;
import com.grey.gate.server.config.ServerConfig;

public class App
	extends com.grey.gate.Launcher
{
	private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(App.class);

	static final String[] opts = new String[]{"greeting:", "quit:"};
	static final String DFLT_CONFIG = "echo-gate.xml";

	public static void main(String[] args) throws Exception
	{
		Logger.info("Starting echo service with logger="+Logger.getClass().getName()+"/"+Logger);
		App app = new App(args);
		app.execute("echo");
	}

	private static class OptsHandler extends CommandParser.OptionsHandler
	{
		String greeting;
		String quit;

		public OptsHandler() {super(opts, 0, 0);}

		@Override
		public void setOption(String opt, String val) {
			if (opt.equals("greeting")) {
				greeting = val;
			} else if (opt.equals("quit")) {
				quit = val;
			} else {
				super.setOption(opt, val);
			}
		}

		@Override
		public String displayUsage()
		{
			return "\t-greeting text -quit command\nBoth are optional, and override the settings in the config file";
		}
	}

	private final OptsHandler options = new OptsHandler();
	private volatile EchoFactory factory;

	public EchoFactory getFactory() {return factory;}

	public App(String[] args)
	{
		this(args, false);
	}

	public App(String[] args, boolean silent)
	{
		super(args, silent);
		cmdParser.addHandler(options);
	}

	// falls back to the config bundled with this application
	@Override
	protected XmlConfig getDefaultConfig() throws java.io.IOException
	{
		java.net.URL url = DynLoader.getLoaderResource(DFLT_CONFIG, getClass().getClassLoader());
		if (url == null) return null;
		Logger.info("Loading bundled config="+url);
		return XmlConfig.makeSection(DynLoader.readText(url), "/gate");
	}

	@Override
	protected HandlerFactory createHandlerFactory(ServerConfig cfg, com.grey.gate.logging.Logger log)
	{
		XmlConfig fcfg = (cfg.getFactoryConfig() == null ? XmlConfig.BLANKCFG : cfg.getFactoryConfig());
		EchoFactory dflt = new EchoFactory(fcfg);
		String greeting = (options.greeting == null ? dflt.getGreeting() : options.greeting);
		String quit = (options.quit == null ? dflt.getQuitCommand() : options.quit);
		factory = new EchoFactory(greeting, quit);
		log.info("Server="+cfg.getName()+": Created factory="+factory);
		return factory;
	}
}

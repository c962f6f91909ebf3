/*
 * Copyright 2011-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.logging;

import com.grey.gate.base.config.SysProps;
import com.grey.gate.base.config.XmlConfig;
import com.grey.gate.base.config.XmlConfig.XmlConfigException;
import com.grey.gate.base.utils.DynLoader;

/**
 * Creates loggers from the named entries of a logging.xml config file, whose layout is
 * <pre>
 * &lt;loggers&gt;
 *   &lt;logger name="default"&gt;
 *     &lt;file class="..." level="INFO"&gt;%stdout%&lt;/file&gt;
 *   &lt;/logger&gt;
 *   &lt;logger name="other"&gt;
 *     &lt;alias&gt;default&lt;/alias&gt;
 *   &lt;/logger&gt;
 * &lt;/loggers&gt;
 * </pre>
 * The config file is looked up on the filesystem first, and then as a classpath resource.
 */
public class Factory
{
	public static final String SYSPROP_CFGFILE = "greygate.logger.configfile";
	public static final String DFLT_LOGNAME = "default";

	/*
	 * Creates a logger based on the default entry in the default logging.xml config file.
	 */
	public static Logger getLogger() throws java.io.IOException
	{
		return getLogger(DFLT_LOGNAME);
	}

	/*
	 * Creates a logger based on the named entry in the default logging.xml config file.
	 */
	public static Logger getLogger(String name) throws java.io.IOException
	{
		return getLogger(getConfigFile(), name);
	}

	/*
	 * Creates a logger based on the named entry in the specified logging.xml config file.
	 */
	public static Logger getLogger(String cfgpath, String name) throws java.io.IOException
	{
		XmlConfig cfg = parseConfig(cfgpath, name, 0);
		return getLogger(cfg, name);
	}

	public static Logger getLogger(XmlConfig cfg, String name) throws java.io.IOException
	{
		Parameters params = new Parameters(cfg);
		return getLogger(params, name);
	}

	public static Logger getLogger(Parameters params, String name) throws java.io.IOException
	{
		if (name == null || name.isEmpty()) name = DFLT_LOGNAME;
		if (params == null) params = new Parameters.Builder().build();
		Logger log;
		try {
			Class<?> clss = DynLoader.loadClass(params.getLogClass());
			java.lang.reflect.Constructor<?> ctor = clss.getDeclaredConstructor(Parameters.class, String.class);
			ctor.setAccessible(true);
			log = Logger.class.cast(ctor.newInstance(params, name));
		} catch (ReflectiveOperationException | ClassCastException ex) {
			throw new IllegalArgumentException("Failed to create logger="+params.getLogClass(), ex);
		}
		log.init();
		return log;
	}

	// Returns null if the config file does not exist, which results in a logger with default settings
	private static XmlConfig parseConfig(String cfgpath, String name, int depth) throws java.io.IOException
	{
		if (depth > 10) throw new XmlConfigException("GreyGate Logger: Excessive alias chain at "+name+" - "+cfgpath);
		String xpath = "/loggers/logger[@name='"+name+"']"+XmlConfig.XPATH_ENABLED;
		java.io.File fh = new java.io.File(cfgpath);
		XmlConfig cfg = null;

		if (fh.exists()) {
			cfg = XmlConfig.getSection(cfgpath, xpath);
		} else {
			java.net.URL url = DynLoader.getLoaderResource(cfgpath, Factory.class.getClassLoader());
			if (url != null) {
				String xmltxt = DynLoader.readText(url);
				cfg = XmlConfig.makeSection(xmltxt, xpath);
			}
		}

		if (cfg != null) {
			String alias = cfg.getValue("alias", false, null);
			if (name.equals(alias)) throw new XmlConfigException("GreyGate Logger: Infinite loop between "+name+" and "+alias+" - "+cfgpath);
			if (alias != null) return parseConfig(cfgpath, alias, depth+1);
			cfg = cfg.getSection("file");
		}
		return cfg;
	}

	private static String getConfigFile()
	{
		String pthnam = SysProps.get(SYSPROP_CFGFILE);
		if (pthnam != null) return pthnam;

		String[] huntpath = new String[]{"./logging.xml",
				"./conf/logging.xml",
				System.getProperty("user.home", ".")+"/logging.xml"};
		for (int idx = 0; idx != huntpath.length; idx++) {
			if (new java.io.File(huntpath[idx]).exists()) return huntpath[idx];
		}
		return "logging.xml";  //may yet be found on the classpath
	}
}

/*
 * Copyright 2015-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.server.config;

import com.grey.gate.base.config.XmlConfig;
import com.grey.gate.base.config.XmlConfig.XmlConfigException;
import com.grey.gate.errors.GateConfigException;

public class ServerConfigTest
{
	@org.junit.Test
	public void testDefaults()
	{
		ServerConfig cfg = new ServerConfig.Builder().build();
		org.junit.Assert.assertEquals("server-0", cfg.getName());
		org.junit.Assert.assertNull(cfg.getInterface());
		org.junit.Assert.assertEquals(0, cfg.getPort());
		org.junit.Assert.assertEquals(ServerConfig.DFLT_BACKLOG, cfg.getBacklog());
		org.junit.Assert.assertEquals(512, cfg.getMaxConns());
		org.junit.Assert.assertEquals(0, cfg.getMaxConnsPerIP());
		org.junit.Assert.assertEquals(1, cfg.getWorkers());
		org.junit.Assert.assertEquals(-1, cfg.getTimeout());
		org.junit.Assert.assertNull(cfg.getConfigSSL());
		org.junit.Assert.assertNull(cfg.getFactoryClass());

		cfg = cfg.mutate().withPort(8080).withName(null).build();
		org.junit.Assert.assertEquals("server-8080", cfg.getName());
		org.junit.Assert.assertEquals(512, cfg.getMaxConns());
	}

	@org.junit.Test
	public void testXmlConfig() throws Exception
	{
		ServerConfig cfg = new ServerConfig.Builder().withXmlConfig(getSection("full")).build();
		org.junit.Assert.assertEquals("full", cfg.getName());
		org.junit.Assert.assertEquals("127.0.0.1", cfg.getInterface());
		org.junit.Assert.assertEquals(8021, cfg.getPort());
		org.junit.Assert.assertEquals(50, cfg.getBacklog());
		org.junit.Assert.assertEquals(10, cfg.getMaxConns());
		org.junit.Assert.assertEquals(2, cfg.getMaxConnsPerIP());
		org.junit.Assert.assertEquals(4, cfg.getWorkers());
		org.junit.Assert.assertEquals(2000, cfg.getTimeout());
		org.junit.Assert.assertEquals("com.grey.gate.server.ProbeHandlerFactory", cfg.getFactoryClass());
		org.junit.Assert.assertEquals("hi", cfg.getFactoryConfig().getValue("greeting", true, null));
		org.junit.Assert.assertNotNull(cfg.getConfigSSL());
		org.junit.Assert.assertEquals("TLSv1.2", cfg.getConfigSSL().getProtocol());
		org.junit.Assert.assertEquals(1, cfg.getConfigSSL().getClientAuth());

		// values not in the XML retain the builder's settings
		cfg = new ServerConfig.Builder()
				.withMaxConns(7)
				.withXmlConfig(getSection("minimal"))
				.build();
		org.junit.Assert.assertEquals("minimal", cfg.getName());
		org.junit.Assert.assertEquals(7, cfg.getMaxConns());
		org.junit.Assert.assertEquals(-1, cfg.getTimeout());
		org.junit.Assert.assertNull(cfg.getConfigSSL());
		org.junit.Assert.assertNull(cfg.getFactoryConfig());

		// the factory class can be omitted, as the launching application may supply its own
		cfg = new ServerConfig.Builder().withXmlConfig(getSection("nofactoryclass")).build();
		org.junit.Assert.assertNull(cfg.getFactoryClass());
		org.junit.Assert.assertTrue(cfg.getFactoryConfig().exists());
	}

	@org.junit.Test
	public void testInvalid() throws Exception
	{
		verifyRejected("badtimeout", GateConfigException.class);
		verifyRejected("badport", GateConfigException.class);
		verifyRejected("badmaxconns", GateConfigException.class);
		verifyRejected("badinteger", XmlConfigException.class);
		verifyRejected("badclientauth", GateConfigException.class);
	}

	private static void verifyRejected(String name, Class<? extends RuntimeException> clss) throws Exception {
		XmlConfig xmlcfg = getSection(name);
		try {
			new ServerConfig.Builder().withXmlConfig(xmlcfg).build();
			org.junit.Assert.fail("Failed to reject server config="+name);
		} catch (RuntimeException ex) {
			org.junit.Assert.assertEquals(name+" - "+ex, clss, ex.getClass());
		}
	}

	static XmlConfig getSection(String name) throws Exception {
		java.net.URL url = ServerConfigTest.class.getResource("/gate-test.xml");
		String pthnam = new java.io.File(url.toURI()).getCanonicalPath();
		XmlConfig cfg = XmlConfig.getSection(pthnam, "/gate/server[@name='"+name+"']");
		org.junit.Assert.assertTrue(name, cfg.exists());
		return cfg;
	}
}

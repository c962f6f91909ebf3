/*
 * Copyright 2011-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.logging;

import com.grey.gate.base.config.XmlConfig.XmlConfigException;
import com.grey.gate.logging.adapters.AdapterSLF4J;

/*
 * Make sure greygate.logger.configfile system property is not set, when running these tests.
 */
public class FactoryTest
{
	private static final String CFGRSRC = "logging-test.xml";

	@org.junit.Test
	public void testParameters()
	{
		Parameters params = new Parameters.Builder().build();
		org.junit.Assert.assertNotNull(params.getLogClass());
		org.junit.Assert.assertNull(params.getPathname());
		org.junit.Assert.assertNotNull(params.getStream());
		org.junit.Assert.assertFalse(params.getBufSize() == 0);

		params = new Parameters.Builder(params)
				.withPathname("%stdout%")
				.build();
		org.junit.Assert.assertNull(params.getPathname());
		org.junit.Assert.assertSame(System.out, params.getStream());

		params = new Parameters.Builder(params)
				.withPathname("%stderr%")
				.build();
		org.junit.Assert.assertNull(params.getPathname());
		org.junit.Assert.assertSame(System.err, params.getStream());

		params = new Parameters.Builder(params)
				.withPathname("blah-%PID%.log")
				.build();
		org.junit.Assert.assertNotNull(params.getPathname());
		org.junit.Assert.assertTrue(params.getPathname(), params.getPathname().endsWith("blah-"+Parameters.CURRENT_PID+".log"));
		org.junit.Assert.assertNull(params.getStream());

		params = new Parameters.Builder(params)
				.withBufferSize(0)
				.withFlushInterval(9)
				.build();
		org.junit.Assert.assertEquals(0, params.getBufSize());
		org.junit.Assert.assertEquals(0, params.getFlushInterval());

		params = new Parameters.Builder(params)
				.withBufferSize(1024)
				.withFlushInterval(9)
				.build();
		org.junit.Assert.assertEquals(1024, params.getBufSize());
		org.junit.Assert.assertEquals(9, params.getFlushInterval());
	}

	@org.junit.Test
	public void testConfiguredLoggers() throws java.io.IOException
	{
		Logger log = Factory.getLogger(CFGRSRC, "memlog");
		org.junit.Assert.assertEquals(MemLogger.class, log.getClass());
		org.junit.Assert.assertEquals(Logger.LEVEL.TRC, log.getLevel());

		// alias resolves to the target's settings, but keeps its own name
		log = Factory.getLogger(CFGRSRC, "aliased");
		org.junit.Assert.assertEquals(MemLogger.class, log.getClass());
		org.junit.Assert.assertEquals("aliased", log.getName());

		log = Factory.getLogger(CFGRSRC, "sink");
		org.junit.Assert.assertEquals(SinkLogger.class, log.getClass());

		log = Factory.getLogger(CFGRSRC, "slf4j");
		org.junit.Assert.assertEquals(AdapterSLF4J.class, log.getClass());
		org.junit.Assert.assertNotNull(((AdapterSLF4J)log).getExternalLogger());
		log.info("Routed to SLF4J");

		// disabled entries are invisible, and so are absent ones, so we get the defaults
		log = Factory.getLogger(CFGRSRC, "disabled");
		org.junit.Assert.assertEquals(MTCharLogger.class, log.getClass());
		log = Factory.getLogger(CFGRSRC, "nosuchlogger");
		org.junit.Assert.assertEquals(MTCharLogger.class, log.getClass());
	}

	@org.junit.Test(expected=XmlConfigException.class)
	public void testAliasLoop() throws java.io.IOException
	{
		Factory.getLogger(CFGRSRC, "loop");
	}

	@org.junit.Test(expected=IllegalArgumentException.class)
	public void testBadClass() throws java.io.IOException
	{
		Parameters params = new Parameters.Builder().withLogClass("com.grey.gate.logging.NoSuchLogger").build();
		Factory.getLogger(params, "bad");
	}

	@org.junit.Test
	public void testInterop()
	{
		org.junit.Assert.assertTrue(Interop.isActive(Logger.LEVEL.INFO, Logger.LEVEL.ERR));
		org.junit.Assert.assertTrue(Interop.isActive(Logger.LEVEL.INFO, Logger.LEVEL.INFO));
		org.junit.Assert.assertFalse(Interop.isActive(Logger.LEVEL.INFO, Logger.LEVEL.TRC));
		org.junit.Assert.assertFalse(Interop.isActive(Logger.LEVEL.OFF, Logger.LEVEL.ERR));
		org.junit.Assert.assertFalse(Interop.isActive(Logger.LEVEL.ALL, Logger.LEVEL.OFF));
		org.junit.Assert.assertTrue(Interop.isActive(Logger.LEVEL.ALL, Logger.LEVEL.TRC5));
		org.junit.Assert.assertTrue(Interop.isActive(Logger.LEVEL.ERR, Logger.LEVEL.ALL));

		org.slf4j.Logger extlog = org.mockito.Mockito.mock(org.slf4j.Logger.class);
		org.mockito.Mockito.when(extlog.isInfoEnabled()).thenReturn(true);
		org.junit.Assert.assertEquals(Logger.LEVEL.INFO, Interop.getLevel(extlog));
		org.mockito.Mockito.when(extlog.isDebugEnabled()).thenReturn(true);
		org.junit.Assert.assertEquals(Logger.LEVEL.TRC, Interop.getLevel(extlog));
	}
}

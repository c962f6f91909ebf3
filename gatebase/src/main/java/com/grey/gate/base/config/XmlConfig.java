/*
 * Copyright 2010-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.base.config;

import com.grey.gate.base.utils.StringOps;
import com.grey.gate.base.utils.TimeOps;
import com.grey.gate.base.utils.XML;

/**This class treats an XML file as a structured config file.
 * <br>
 * Calling applications just see this as a config structure, so to spare them from the underlying XML intricacies, we
 * map all exceptions to XmlConfigException.
 * Note that we can retrieve attributes and values at the top-level node of an XmlConfig element using XPath dot notation
 * Eg. "./@attrname" or "." for Text
 */
public class XmlConfig
{
	public static final String XPATH_ENABLED = "[@enabled='Y' or not(@enabled)]";
	public static final String NULLMARKER = "-";  // gets translated to null, and prevents us traversing the chain of defaults

	private static final boolean trace_stdout = SysProps.get("greygate.config.trace", false);
	private static final String XPATH_SEP = "/";
	private static final String SECT_SEP = "::";
	private static final String ELEM_SEP = "##";

	public static final XmlConfig NULLCFG = new XmlConfig();  // exists() returns False
	public static final XmlConfig BLANKCFG = makeSection("<x/>", XPATH_SEP+"x");  // exists() returns True

	private final javax.xml.xpath.XPath xpathproc;
	private org.w3c.dom.Node cfgsect;
	private XmlConfig cfgDefaults;
	private String label;

	public boolean exists() {return (cfgsect != null);}

	public static XmlConfig getSection(CharSequence pthnam, String node_xpath)
	{
		org.w3c.dom.Document xmldoc = null;
		try {
			xmldoc = XML.getDOM(pthnam);
		} catch (Exception ex) {
			throw new XmlConfigException("Failed to parse DOM from config-file="+pthnam, ex);
		}
		return getSection(xmldoc, node_xpath);
	}

	public static XmlConfig makeSection(CharSequence xmltxt, String node_xpath)
	{
		org.w3c.dom.Document xmldoc = null;
		try {
			xmldoc = XML.makeDOM(xmltxt);
		} catch (Exception ex) {
			throw new XmlConfigException("Failed to build DOM for config-section ["+xmltxt+"]", ex);
		}
		return getSection(xmldoc, node_xpath);
	}

	private static XmlConfig getSection(org.w3c.dom.Document xmldoc, String node_xpath)
	{
		javax.xml.xpath.XPath xpathproc = XML.getXpathProcessor();
		return new XmlConfig(xpathproc, xmldoc, node_xpath);
	}

	private XmlConfig(XmlConfig cfg, String node_xpath)
	{
		xpathproc = cfg.xpathproc;
		label = cfg.label;
		setup(cfg.cfgsect, node_xpath);
	}

	// 'node' has already been looked up, so node_xpath merely annotates the descriptive label
	private XmlConfig(XmlConfig cfg, org.w3c.dom.Node node, String node_xpath)
	{
		xpathproc = cfg.xpathproc;
		label = cfg.label;
		cfgsect = node;
		setup(null, node_xpath);
	}

	private XmlConfig(javax.xml.xpath.XPath xpathproc_p, Object parentNode, String node_xpath)
	{
		xpathproc = xpathproc_p;
		setup(parentNode, node_xpath);
	}

	// Only used for NULLCFG
	private XmlConfig()
	{
		xpathproc = XML.getXpathProcessor();
		setup(null, "");
	}

	// Null parentNode means cfgsect has already been looked up (or else not required)
	private void setup(Object parentNode, String node_xpath)
	{
		if (parentNode != null) {
			// evaluate() returns null if the node does not exist, and only throws on invalid XPath syntax
			try {
				cfgsect = (org.w3c.dom.Node)xpathproc.evaluate(node_xpath, parentNode, javax.xml.xpath.XPathConstants.NODE);
			} catch (Exception ex) {
				throw new XmlConfigException("XML-Config: evaluate() failed on XPath="+node_xpath, ex);
			}
		}

		if (label == null) {
			label = "";
		} else {
			label += SECT_SEP;
		}
		label += node_xpath;
		if (trace_stdout) System.out.println("Config section [" + label + "] " + (cfgsect==null?"absent":"present"));
	}

	public void setDefaults(XmlConfig dflts)
	{
		cfgDefaults = dflts;
	}

	public XmlConfig getSection(String node_xpath)
	{
		return new XmlConfig(this, node_xpath);
	}

	public XmlConfig[] getSections(String xpath)
	{
		org.w3c.dom.NodeList nodes = null;
		if (cfgsect != null) {
			try {
				nodes = (org.w3c.dom.NodeList)xpathproc.evaluate(xpath, cfgsect, javax.xml.xpath.XPathConstants.NODESET);
			} catch (Exception ex) {
				throw new XmlConfigException("XML-Config: evaluate() failed on XPath="+xpath, ex);
			}
		}

		if (nodes == null || nodes.getLength() == 0) {
			if (cfgDefaults != null) return cfgDefaults.getSections(xpath);
			return null;
		}
		XmlConfig[] sects = new XmlConfig[nodes.getLength()];

		for (int idx = 0; idx != sects.length; idx++) {
			sects[idx] = new XmlConfig(this, nodes.item(idx), xpath+"["+idx+"]");
		}
		return sects;
	}

	public String getValue(String xpath, boolean mdty, String dflt)
	{
		String dflt2 = (cfgDefaults == null ? dflt : cfgDefaults.getValue(xpath, false, dflt));
		String cfgval = getValue(cfgsect, xpath, mdty, dflt2);
		if (trace_stdout) System.out.println("Config item [" + label + ELEM_SEP + xpath + " = " + cfgval + "]");
		return cfgval;
	}

	// if mdty is true, then dflt=0 indicates the absence of a default
	public int getInt(String xpath, boolean mdty, int dflt)
	{
		String str = getValue(xpath, mdty, (mdty && dflt == 0) ? null : String.valueOf(dflt));
		try {
			return Integer.parseInt(str);
		} catch (NumberFormatException ex) {
			configError(xpath, "Invalid integer value - "+str);
			return 0; //unreachable, configError() throws
		}
	}

	public boolean getBool(String xpath, boolean dflt)
	{
		String str = getValue(xpath, false, StringOps.boolAsString(dflt));
		return StringOps.stringAsBool(str);
	}

	public long getTime(String xpath, String dflt)
	{
		return getTime(xpath, TimeOps.parseMilliTime(dflt));
	}

	public long getTime(String xpath, long dflt)
	{
		String str = getValue(xpath, false, Long.toString(dflt));
		try {
			return TimeOps.parseMilliTime(str);
		} catch (NumberFormatException ex) {
			configError(xpath, "Invalid time value - "+str);
			return 0; //unreachable, configError() throws
		}
	}

	public char[] getPassword(String xpath, char[] dflt)
	{
		String s_dflt = (dflt == null ? null : new String(dflt));
		String s_passwd = getValue(xpath, false, s_dflt);
		return (s_passwd == null ? null : s_passwd.toCharArray());
	}

	private String getValue(Object cfg, String xpath, boolean mdty, String dflt)
	{
		org.w3c.dom.Node elem = null;
		String cfgval = null;

		if (cfg != null) {
			try {
				elem = (org.w3c.dom.Node)xpathproc.evaluate(xpath, cfg, javax.xml.xpath.XPathConstants.NODE);
			} catch (Exception ex) {
				throw new XmlConfigException("XML-Config: evaluate() failed on XPath="+xpath, ex);
			}
		}

		if (elem != null) {
			cfgval = elem.getTextContent();
			if (cfgval != null) cfgval = cfgval.trim();
		}

		if (cfgval == null || cfgval.length() == 0) {
			cfgval = dflt;
		} else if (cfgval.equals(NULLMARKER)) {
			cfgval = null;
		}
		if (mdty && (cfgval == null || cfgval.length() == 0)) configError(xpath, "Missing mandatory item");
		return cfgval;
	}

	private void configError(String xpath, String msg)
	{
		String str = "CONFIG ERROR: "+msg+" - "+label+ELEM_SEP+xpath;
		throw new XmlConfigException(str);
	}

	@Override
	public String toString() {
		return "label="+label+"::"+(cfgsect == null ? "null" : XML.toString(cfgsect));
	}


	public static class XmlConfigException extends RuntimeException {
		private static final long serialVersionUID = 1L;

		public XmlConfigException(String msg) {
			super(msg);
		}

		public XmlConfigException(String msg, Throwable ex) {
			super(msg, ex);
		}
	}
}

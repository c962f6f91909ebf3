/*
 * Copyright 2012-2024 Yusef Badri - All rights reserved.
 * GreyGate is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.grey.gate.reactor.config;

import com.grey.gate.base.config.SysProps;
import com.grey.gate.base.config.XmlConfig;
import com.grey.gate.errors.GateConfigException;

/**
 * Server-side TLS settings.
 * <br>
 * The SSLContext is built by the constructor, so that a bad keystore or protocol is reported when the
 * configuration is loaded rather than on the first connection.
 */
public class SSLConfig
{
	public static final String KSTYPE_JKS = "JKS";
	public static final String KSTYPE_PKCS12 = "PKCS12";

	private final String protocol;
	private final int clientAuth; //0=No, 1=Will-Accept, 2=Need
	private final String localCertAlias; //keystore alias
	private final String storeFormat;
	private final java.net.URL storePath;
	private final String trustFormat;
	private final java.net.URL trustPath;
	private final javax.net.ssl.SSLContext ctx;

	public SSLConfig(Builder bldr)
	{
		if (bldr.clientAuth < 0 || bldr.clientAuth > 2) {
			throw new GateConfigException("Illegal client-auth="+bldr.clientAuth);
		}
		protocol = bldr.protocol;
		clientAuth = bldr.clientAuth;
		localCertAlias = bldr.localCertAlias;
		storeFormat = bldr.storeFormat;
		storePath = bldr.storePath;
		trustFormat = bldr.trustFormat;
		trustPath = bldr.trustPath;

		try {
			ctx = initContext(protocol, localCertAlias, storeFormat, storePath, trustFormat, trustPath,
								bldr.storePasswd, bldr.certPasswd, bldr.trustPasswd);
		} catch (GateConfigException ex) {
			throw ex;
		} catch (Exception ex) {
			throw new GateConfigException("Failed to create SSL context", ex);
		}
	}

	public String getProtocol() {
		return protocol;
	}

	public int getClientAuth() {
		return clientAuth;
	}

	public String getLocalCertAlias() {
		return localCertAlias;
	}

	public String getStoreFormat() {
		return storeFormat;
	}

	public java.net.URL getStorePath() {
		return storePath;
	}

	public String getTrustFormat() {
		return trustFormat;
	}

	public java.net.URL getTrustPath() {
		return trustPath;
	}

	public javax.net.ssl.SSLContext getContext() {
		return ctx;
	}

	@Override
	public String toString()
	{
		String txt = super.toString()+": Context="+getContext().getProtocol()+"/"+getContext().getProvider().getName()
				+"; client-auth="+getClientAuth();
		if (getLocalCertAlias() != null) {
			txt += "; local-cert="+getLocalCertAlias()+"; format="+getStoreFormat()+" - "+getStorePath();
		}
		if (getTrustPath() != null) txt += "; trust-format="+getTrustFormat()+" - "+getTrustPath();
		return txt;
	}

	private static javax.net.ssl.SSLContext initContext(String protocol, String localCertAlias,
			String storeFormat, java.net.URL storePath, String trustFormat, java.net.URL trustPath,
			char[] storePasswd, char[] certPasswd, char[] trustPasswd) throws java.io.IOException, java.security.GeneralSecurityException {
		if (certPasswd == null) certPasswd = storePasswd;
		javax.net.ssl.SSLContext ctx = javax.net.ssl.SSLContext.getInstance(protocol);
		javax.net.ssl.KeyManagerFactory kmf = null;
		javax.net.ssl.TrustManagerFactory tmf = null;

		if (storePath != null) {
			java.security.KeyStore ksmaster = loadStore(storePath, storeFormat, storePasswd);
			java.security.KeyStore ks = ksmaster;
			if (localCertAlias != null) {
				// we've been told which certificate to present, so construct a dedicated key store for it
				java.security.Key localkey = ksmaster.getKey(localCertAlias, certPasswd);
				java.security.cert.Certificate[] localcert = ksmaster.getCertificateChain(localCertAlias);
				if (localkey == null || localcert == null) {
					throw new GateConfigException("SSLConfig: Certificate alias="+localCertAlias+" not found in "+storePath);
				}
				ks = java.security.KeyStore.getInstance(KSTYPE_JKS);
				ks.load(null, null);
				ks.setKeyEntry(localCertAlias, localkey, certPasswd, localcert);
			}
			kmf = javax.net.ssl.KeyManagerFactory.getInstance(javax.net.ssl.KeyManagerFactory.getDefaultAlgorithm());
			kmf.init(ks, certPasswd);
		} else if (localCertAlias != null) {
			throw new GateConfigException("SSLConfig: Must supply private-key store for cert="+localCertAlias);
		}

		if (trustPath != null) {
			// we have been given an explicit set of certificates to trust
			java.security.KeyStore ts = loadStore(trustPath, trustFormat, trustPasswd);
			tmf = javax.net.ssl.TrustManagerFactory.getInstance(javax.net.ssl.TrustManagerFactory.getDefaultAlgorithm());
			tmf.init(ts);
		}
		ctx.init(kmf == null ? null : kmf.getKeyManagers(), tmf == null ? null : tmf.getTrustManagers(), null);
		return ctx;
	}

	private static java.security.KeyStore loadStore(java.net.URL pthnam, String type, char[] passwd)
			throws java.io.IOException, java.security.GeneralSecurityException
	{
		java.security.KeyStore store = java.security.KeyStore.getInstance(type);
		try (java.io.InputStream fin = pthnam.openStream()) {
			store.load(fin, passwd);
		}
		return store;
	}

	public static class Builder
	{
		private String protocol = "TLSv1.2";
		private int clientAuth = 0;
		private String localCertAlias;
		private String storeFormat = SysProps.get("javax.net.ssl.keyStoreType", java.security.KeyStore.getDefaultType());
		private java.net.URL storePath = makeURL(SysProps.get("javax.net.ssl.keyStore"));
		private String trustFormat = SysProps.get("javax.net.ssl.trustStoreType", java.security.KeyStore.getDefaultType());
		private java.net.URL trustPath = makeURL(SysProps.get("javax.net.ssl.trustStore"));
		private char[] storePasswd = makeChars(SysProps.get("javax.net.ssl.keyStorePassword"));
		private char[] certPasswd;
		private char[] trustPasswd = makeChars(SysProps.get("javax.net.ssl.trustStorePassword"));

		public Builder withXmlConfig(XmlConfig cfg) {
			protocol = cfg.getValue("@proto", false, protocol);
			clientAuth = cfg.getInt("@clientauth", false, clientAuth);
			localCertAlias = cfg.getValue("@cert", false, localCertAlias);
			storeFormat = cfg.getValue("@kstype", false, storeFormat);
			storePasswd = cfg.getPassword("@kspass", storePasswd);
			certPasswd = cfg.getPassword("@certpass", certPasswd);
			trustFormat = cfg.getValue("@tstype", false, trustFormat);
			trustPasswd = cfg.getPassword("@tspass", trustPasswd);
			storePath = makeURL(cfg.getValue("@kspath", false, storePath == null ? null : storePath.toString()));
			trustPath = makeURL(cfg.getValue("@tspath", false, trustPath == null ? null : trustPath.toString()));
			return this;
		}

		public Builder withProtocol(String v) {
			protocol = v;
			return this;
		}

		public Builder withClientAuth(int v) {
			clientAuth = v;
			return this;
		}

		public Builder withLocalCertAlias(String v) {
			localCertAlias = v;
			return this;
		}

		public Builder withStoreFormat(String v) {
			storeFormat = v;
			return this;
		}

		public Builder withStorePath(java.net.URL v) {
			storePath = v;
			return this;
		}

		public Builder withTrustFormat(String v) {
			trustFormat = v;
			return this;
		}

		public Builder withTrustPath(java.net.URL v) {
			trustPath = v;
			return this;
		}

		public Builder withStorePasswd(char[] v) {
			storePasswd = v;
			return this;
		}

		public Builder withCertPasswd(char[] v) {
			certPasswd = v;
			return this;
		}

		public Builder withTrustPasswd(char[] v) {
			trustPasswd = v;
			return this;
		}

		public SSLConfig build() {
			return new SSLConfig(this);
		}

		// accepts URLs, classpath resources (cp:name) and plain pathnames
		static java.net.URL makeURL(String pthnam) {
			if (pthnam == null) return null;
			try {
				if (pthnam.startsWith("cp:")) {
					java.net.URL url = com.grey.gate.base.utils.DynLoader.getLoaderResource(pthnam.substring(3), null);
					if (url == null) throw new GateConfigException("SSLConfig: No such resource="+pthnam);
					return url;
				}
				if (pthnam.indexOf(':') > 1) return new java.net.URL(pthnam);
				return new java.io.File(pthnam).toURI().toURL(); //must be a straight pathname, so convert to URL syntax
			} catch (java.net.MalformedURLException ex) {
				throw new GateConfigException("Failed to make URL from "+pthnam, ex);
			}
		}

		private static char[] makeChars(String str) {
			if (str == null || str.length() == 0) return null;
			return str.toCharArray();
		}
	}
}

package org.learningjava.blockprog.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "blockprog")
public class BlockProgProperties {
    private final Parser parser = new Parser();
    private final Web web = new Web();
    private final Scan scan = new Scan();

    public Parser getParser() { return parser; }
    public Web getWeb() { return web; }
    public Scan getScan() { return scan; }

    public static class Parser {
        private boolean allowDoctype = false;

        public boolean isAllowDoctype() { return allowDoctype; }
        public void setAllowDoctype(boolean v) { this.allowDoctype = v; }
    }

    public static class Web {
        private int maxDocumentChars = 1_000_000;

        public int getMaxDocumentChars() { return maxDocumentChars; }
        public void setMaxDocumentChars(int v) { this.maxDocumentChars = v; }
    }

    public static class Scan {
        private String extension = ".xml";

        public String getExtension() { return extension; }
        public void setExtension(String v) { this.extension = v; }
    }
}

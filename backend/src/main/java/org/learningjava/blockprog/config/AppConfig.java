package org.learningjava.blockprog.config;

import org.learningjava.blockprog.application.port.DocumentParserPort;
import org.learningjava.blockprog.application.port.DocumentSourcePort;
import org.learningjava.blockprog.infrastructure.adapter.out.dom.DomDocumentParserAdapter;
import org.learningjava.blockprog.infrastructure.adapter.out.fs.FileSystemDocumentSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    //adapters for the XML library and the file system
    @Bean
    DocumentParserPort documentParser(BlockProgProperties props) {
        return new DomDocumentParserAdapter(props.getParser().isAllowDoctype());
    }

    @Bean
    DocumentSourcePort documentSource(BlockProgProperties props) {
        return new FileSystemDocumentSource(props.getScan().getExtension());
    }
}

package com.dcruver.medi.config;

import com.dcruver.medi.search.SearchIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Opens the search index once per process; closed on shutdown.
 */
@Configuration
@Slf4j
public class SearchConfig {

    @Bean(destroyMethod = "close")
    public SearchIndex searchIndex(MediProperties properties) {
        log.debug("Opening search index at {}", properties.resolveIndexPath());
        return SearchIndex.openOrCreate(properties.resolveIndexPath(), properties.getIndex().getWriterBufferMb());
    }
}

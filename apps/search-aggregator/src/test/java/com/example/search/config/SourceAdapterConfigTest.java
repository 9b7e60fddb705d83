package com.example.search.config;

import com.example.search.identity.model.IdentityContext;
import com.example.search.source.adapter.SourceAdapterRegistry;
import com.example.search.source.adapter.gdrive.GoogleDriveAdapter;
import com.example.search.source.adapter.sample.SampleSourceAdapter;
import com.example.search.source.model.SourceId;
import com.example.search.util.IdentityContextTestBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "app.sources.gdrive.mode=LIVE",
        "app.sources.gdrive.base-url=http://localhost:1/drive/v3"
})
@ActiveProfiles("test")
@DisplayName("SourceAdapterConfig in live Drive mode, set in upper case")
class SourceAdapterConfigTest {

    @Autowired
    private SourceAdapterRegistry registry;

    @Test
    @DisplayName("Live Drive factory should replace the Drive fixtures and leave the others in place")
    void liveFactoryWins() {
        IdentityContext identity = IdentityContextTestBuilder.aFullAccessIdentity();

        assertThat(registry.resolve(identity, SourceId.GDRIVE)).get().isInstanceOf(GoogleDriveAdapter.class);
        assertThat(registry.resolve(identity, SourceId.NOTION)).get().isInstanceOf(SampleSourceAdapter.class);
        assertThat(registry.registeredSources()).containsExactlyInAnyOrder(SourceId.values());
    }
}

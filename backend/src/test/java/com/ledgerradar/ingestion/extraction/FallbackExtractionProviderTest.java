package com.ledgerradar.ingestion.extraction;

import com.ledgerradar.ingestion.error.ExtractionProviderException;
import com.ledgerradar.ingestion.error.ExtractionTimeoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class FallbackExtractionProviderTest {

    @Mock
    ExtractionProvider primary;
    @Mock
    ExtractionProvider secondary;

    private final PageContext page = PageContext.forText(4, 5, "", "EUR").withImage("png", null);
    private final PageCandidate candidate = new PageCandidate(List.of(), null, null, null);

    @Test
    @DisplayName("first provider's candidate wins and the next is never called")
    void firstWins() {
        when(primary.extract(page)).thenReturn(candidate);

        assertThat(new FallbackExtractionProvider(List.of(primary, secondary)).extract(page)).isSameAs(candidate);
        verify(secondary, never()).extract(any());
    }

    @Test
    @DisplayName("failure of the first provider falls through to the next")
    void fallsThrough() {
        when(primary.name()).thenReturn("openai-vision");
        when(primary.extract(page)).thenThrow(new ExtractionTimeoutException("slow"));
        when(secondary.extract(page)).thenReturn(candidate);

        assertThat(new FallbackExtractionProvider(List.of(primary, secondary)).extract(page)).isSameAs(candidate);
    }

    @Test
    @DisplayName("when every provider fails the last failure is rethrown")
    void allFail() {
        ExtractionProviderException last = new ExtractionProviderException("401");
        when(primary.extract(page)).thenThrow(new ExtractionTimeoutException("slow"));
        when(secondary.extract(page)).thenThrow(last);

        assertThatThrownBy(() -> new FallbackExtractionProvider(List.of(primary, secondary)).extract(page)).isSameAs(last);
    }

    @Test
    void name_joinsChainAndEmptyChainRejected() {
        when(primary.name()).thenReturn("a");
        when(secondary.name()).thenReturn("b");

        assertThat(new FallbackExtractionProvider(List.of(primary, secondary)).name()).isEqualTo("a>b");
        assertThatThrownBy(() -> new FallbackExtractionProvider(List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}

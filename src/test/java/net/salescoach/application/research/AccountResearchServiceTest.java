package net.salescoach.application.research;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import net.salescoach.application.ai.AiGatewayClient;
import net.salescoach.support.stream.AnalysisFrame;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

class AccountResearchServiceTest {

    private AiGatewayClient aiGatewayClient;
    private AccountResearchService service;

    @BeforeEach
    void setUp() {
        aiGatewayClient = mock(AiGatewayClient.class);
        service = new AccountResearchService(aiGatewayClient, new ResearchPromptBuilder(), "");
    }

    @Test
    void model_FallsBackToDefault_WhenBlank() {
        assertThat(service.model()).isEqualTo("google/gemini-2.5-pro");
    }

    @Test
    void stream_DelegatesToGatewayWithResearchPrompt() {
        when(aiGatewayClient.streamCompletion(eq("google/gemini-2.5-pro"), anyString(), contains("Acme Corp")))
            .thenReturn(Flux.just(AnalysisFrame.delta("## Company Overview"), AnalysisFrame.done()));

        StepVerifier.create(service.stream(new AccountResearchRequest("Acme Corp", null, null, null, null, null, null, null)))
            .expectNext(AnalysisFrame.delta("## Company Overview"))
            .expectNext(AnalysisFrame.done())
            .verifyComplete();
    }

    @Test
    void stream_RejectsInvalidRequest_BeforeContactingGateway() {
        assertThatThrownBy(() -> service.stream(new AccountResearchRequest("", null, null, null, null, null, null, null)))
            .isInstanceOfSatisfying(InvalidResearchRequestException.class,
                ex -> assertThat(ex.violations()).containsExactly("companyName: Company name is required"));
        verifyNoInteractions(aiGatewayClient);
    }

    @Test
    void stream_RejectsMissingBody() {
        assertThatThrownBy(() -> service.stream(null))
            .isInstanceOf(InvalidResearchRequestException.class);
        verifyNoInteractions(aiGatewayClient);
    }
}

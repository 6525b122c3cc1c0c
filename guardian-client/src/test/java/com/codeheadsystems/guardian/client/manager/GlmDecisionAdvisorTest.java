package com.codeheadsystems.guardian.client.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.guardian.client.accessor.GlmAccessor;
import com.codeheadsystems.guardian.client.exceptions.DecisionAdvisorException;
import com.codeheadsystems.guardian.client.exceptions.GlmAccessorException;
import com.codeheadsystems.guardian.client.model.ChatCompletionRequest;
import com.codeheadsystems.guardian.client.model.ChatCompletionResponse;
import com.codeheadsystems.guardian.client.model.ChatMessage;
import com.codeheadsystems.guardian.core.model.Decision;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GlmDecisionAdvisorTest {

  private static final String PROMPT = "Analyze repository: acme/widgets";
  private static final String KEY = "glm-key";

  @Mock private GlmAccessor accessor;

  private GlmDecisionAdvisor advisor(String apiKey) {
    return new GlmDecisionAdvisor(accessor, new ObjectMapper(), apiKey, "glm-4-air", "extract");
  }

  private static ChatCompletionResponse answer(String content) {
    return new ChatCompletionResponse(List.of(new ChatCompletionResponse.Choice(new ChatMessage("assistant", content))));
  }

  @Test
  void decide_parsesModelAnswer() {
    when(accessor.complete(eq(KEY), any(ChatCompletionRequest.class)))
        .thenReturn(answer("{\"action\":\"skip\",\"reason\":\"docs only\"}"));

    Decision decision = advisor(KEY).decide(PROMPT);

    assertThat(decision).isEqualTo(new Decision("skip", "docs only"));
    ArgumentCaptor<ChatCompletionRequest> captor = ArgumentCaptor.forClass(ChatCompletionRequest.class);
    verify(accessor).complete(eq(KEY), captor.capture());
    assertThat(captor.getValue().model()).isEqualTo("glm-4-air");
    assertThat(captor.getValue().messages()).containsExactly(
        ChatMessage.system(GlmDecisionAdvisor.SYSTEM_PROMPT), ChatMessage.user(PROMPT));
  }

  @Test
  void decide_samePromptTwice_callsModelOnce() {
    when(accessor.complete(eq(KEY), any(ChatCompletionRequest.class)))
        .thenReturn(answer("{\"action\":\"extract\",\"reason\":\"integrations\"}"));
    GlmDecisionAdvisor advisor = advisor(KEY);

    Decision first = advisor.decide(PROMPT);
    Decision second = advisor.decide(PROMPT);

    assertThat(second).isSameAs(first);
    verify(accessor, times(1)).complete(eq(KEY), any(ChatCompletionRequest.class));
  }

  @Test
  void decide_fencedAnswer_isAccepted() {
    when(accessor.complete(eq(KEY), any(ChatCompletionRequest.class)))
        .thenReturn(answer("```json\n{\"action\":\"extract\",\"reason\":\"ci\"}\n```"));

    assertThat(advisor(KEY).decide(PROMPT).proceed()).isTrue();
  }

  @Test
  void decide_missingFields_defaultToUnknown() {
    when(accessor.complete(eq(KEY), any(ChatCompletionRequest.class))).thenReturn(answer("{}"));

    Decision decision = advisor(KEY).decide(PROMPT);

    assertThat(decision.action()).isEqualTo("unknown");
    assertThat(decision.proceed()).isFalse();
  }

  @Test
  void decide_noApiKey_usesDefaultActionWithoutCalling() {
    Decision decision = advisor(" ").decide(PROMPT);

    assertThat(decision.action()).isEqualTo("extract");
    verifyNoInteractions(accessor);
  }

  @Test
  void decide_transportFailure_throwsAndDoesNotCache() {
    when(accessor.complete(eq(KEY), any(ChatCompletionRequest.class)))
        .thenThrow(new GlmAccessorException("Completions endpoint returned HTTP 503", null))
        .thenReturn(answer("{\"action\":\"extract\",\"reason\":\"retry worked\"}"));
    GlmDecisionAdvisor advisor = advisor(KEY);

    assertThatThrownBy(() -> advisor.decide(PROMPT))
        .isInstanceOf(DecisionAdvisorException.class)
        .hasCauseInstanceOf(GlmAccessorException.class);
    assertThat(advisor.decide(PROMPT).reason()).isEqualTo("retry worked");
  }

  @Test
  void decide_nonJsonAnswer_throwsDecisionAdvisorException() {
    when(accessor.complete(eq(KEY), any(ChatCompletionRequest.class))).thenReturn(answer("Sure, extract it."));

    assertThatThrownBy(() -> advisor(KEY).decide(PROMPT)).isInstanceOf(DecisionAdvisorException.class);
  }

  @Test
  void sha256_isStableHex() {
    assertThat(GlmDecisionAdvisor.sha256("abc"))
        .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
  }
}

package com.proof2pay.orchestrator.client;

import com.slack.api.Slack;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.response.chat.ChatPostMessageResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SlackChatTransportTest {

    @Mock
    private Slack slack;

    @Mock
    private MethodsClient methods;

    @Test
    void shouldPostMessageToChannel() throws Exception {
        ChatPostMessageResponse response = new ChatPostMessageResponse();
        response.setOk(true);
        when(slack.methods("xoxb-test")).thenReturn(methods);
        when(methods.chatPostMessage(any(ChatPostMessageRequest.class))).thenReturn(response);
        SlackChatTransport transport = new SlackChatTransport(slack);
        transport.setSlackBotToken("xoxb-test");

        transport.post("C123", "*Daily briefing*");

        ArgumentCaptor<ChatPostMessageRequest> captor = ArgumentCaptor.forClass(ChatPostMessageRequest.class);
        verify(methods).chatPostMessage(captor.capture());
        assertEquals("C123", captor.getValue().getChannel());
        assertEquals("*Daily briefing*", captor.getValue().getText());
    }

    @Test
    void shouldDropPostsWithoutToken() {
        SlackChatTransport transport = new SlackChatTransport(slack);
        transport.setSlackBotToken("");

        transport.post("C123", "hello");

        verifyNoInteractions(slack);
    }

    @Test
    void shouldNotPropagateTransportFailures() throws Exception {
        when(slack.methods("xoxb-test")).thenReturn(methods);
        when(methods.chatPostMessage(any(ChatPostMessageRequest.class))).thenThrow(new IOException("offline"));
        SlackChatTransport transport = new SlackChatTransport(slack);
        transport.setSlackBotToken("xoxb-test");

        assertDoesNotThrow(() -> transport.post("C123", "hello"));
    }
}

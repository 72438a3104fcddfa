package org.waabox.courier.push.ws;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link JdkWebSocketConnection}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class JdkWebSocketConnectionTest {

  @Test
  void whenSendingText_givenPendingSend_shouldWaitForIt() {
    final WebSocket socket = createMock(WebSocket.class);
    final CompletableFuture<WebSocket> first = new CompletableFuture<>();
    expect(socket.sendText("one", true)).andReturn(first);
    expect(socket.sendText("two", true))
        .andReturn(CompletableFuture.completedFuture(socket));
    replay(socket);

    final JdkWebSocketConnection connection =
        new JdkWebSocketConnection(socket);
    connection.sendText("one");
    connection.sendText("two");

    // "two" is only sent once "one" completes.
    first.complete(socket);

    verify(socket);
  }

  @Test
  void whenSendingText_givenPreviousFailure_shouldStillSend() {
    final WebSocket socket = createMock(WebSocket.class);
    expect(socket.sendText("one", true)).andReturn(
        CompletableFuture.failedFuture(new IOException("broken")));
    expect(socket.sendText("two", true))
        .andReturn(CompletableFuture.completedFuture(socket));
    replay(socket);

    final JdkWebSocketConnection connection =
        new JdkWebSocketConnection(socket);
    connection.sendText("one");
    connection.sendText("two");

    verify(socket);
  }

  @Test
  void whenPinging_shouldSendAnEmptyPing() {
    final WebSocket socket = createMock(WebSocket.class);
    expect(socket.sendPing(anyObject(ByteBuffer.class)))
        .andReturn(CompletableFuture.completedFuture(socket));
    replay(socket);

    new JdkWebSocketConnection(socket).sendPing();

    verify(socket);
  }

  @Test
  void whenClosing_givenPeerAnswers_shouldNotAbort() {
    final WebSocket socket = createMock(WebSocket.class);
    expect(socket.sendClose(eq(1000), eq("shutdown")))
        .andReturn(CompletableFuture.completedFuture(socket));
    expect(socket.isInputClosed()).andReturn(true);
    replay(socket);

    new JdkWebSocketConnection(socket, Runnable::run)
        .close(1000, "shutdown");

    verify(socket);
  }

  @Test
  void whenClosing_givenStalledPeerNeverAnswers_shouldAbort() {
    final WebSocket socket = createMock(WebSocket.class);
    expect(socket.sendClose(eq(4000), eq("ping timeout")))
        .andReturn(CompletableFuture.completedFuture(socket));
    expect(socket.isInputClosed()).andReturn(false);
    socket.abort();
    expectLastCall();
    replay(socket);

    new JdkWebSocketConnection(socket, Runnable::run)
        .close(4000, "ping timeout");

    verify(socket);
  }

  @Test
  void whenClosing_shouldWaitBeforeCheckingThePeer() {
    final WebSocket socket = createMock(WebSocket.class);
    expect(socket.sendClose(eq(1000), eq("shutdown")))
        .andReturn(CompletableFuture.completedFuture(socket));
    replay(socket);
    final List<Runnable> pending = new ArrayList<>();

    new JdkWebSocketConnection(socket, pending::add).close(1000, "shutdown");

    // Nothing is checked until the watchdog fires.
    assertEquals(1, pending.size());
    verify(socket);
  }

  @Test
  void whenClosing_givenHandshakeFails_shouldAbort() {
    final WebSocket socket = createMock(WebSocket.class);
    expect(socket.sendClose(eq(4000), eq("ping timeout"))).andReturn(
        CompletableFuture.failedFuture(new IOException("broken pipe")));
    socket.abort();
    expectLastCall();
    replay(socket);

    new JdkWebSocketConnection(socket).close(4000, "ping timeout");

    verify(socket);
  }

  @Test
  void whenClosing_givenSendRejected_shouldAbort() {
    final WebSocket socket = createMock(WebSocket.class);
    expect(socket.sendClose(eq(1000), eq("")))
        .andThrow(new IllegalStateException("output closed"));
    socket.abort();
    expectLastCall();
    replay(socket);

    new JdkWebSocketConnection(socket).close(1000, null);

    verify(socket);
  }
}

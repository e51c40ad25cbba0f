package com.phillippitts.liverelay.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void liveRelayExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("IO failure");
        LiveRelayException ex = new LiveRelayException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void invalidCommandExceptionShouldKeepCommandName() {
        InvalidCommandException named = new InvalidCommandException("start", "bad mode");
        InvalidCommandException anonymous = new InvalidCommandException("Invalid JSON command: empty line");

        assertThat(named.getCommand()).isEqualTo("start");
        assertThat(named.getMessage()).isEqualTo("bad mode");
        assertThat(anonymous.getCommand()).isNull();
        assertThat(named).isInstanceOf(LiveRelayException.class);
    }

    @Test
    void sessionExceptionShouldExtendBase() {
        SessionException ex = new SessionException("Setup timed out");

        assertThat(ex).isInstanceOf(LiveRelayException.class);
        assertThat(ex.getMessage()).isEqualTo("Setup timed out");
    }

    @Test
    void toolRpcExceptionShouldDefaultServerName() {
        assertThat(new ToolRpcException("x").getServerName()).isEqualTo("unknown");
        assertThat(new ToolRpcException("x", "calc").getServerName()).isEqualTo("calc");
    }
}

package alpha.nomagicresponder.responder;

import alpha.nomagicresponder.message.Response;
import alpha.nomagicresponder.message.Responses;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

import static alpha.nomagicresponder.testutil.Assertions.assertFailed;
import static alpha.nomagicresponder.testutil.Assertions.assertSucceeded;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Small tests of {@link NormalizedFuture}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class NormalizedFutureTest
{
    @Test
    void success_passesThrough() {
        var rsp = Responses.ok();
        var f = NormalizedFuture.of(CompletableFuture.completedFuture(rsp), FailureConverter.BASE);
        assertThat(assertSucceeded(f)).isSameAs(rsp);
    }

    @Test
    void failure_isConverted() {
        var ise = new IllegalStateException();
        var f = NormalizedFuture.of(CompletableFuture.failedFuture(ise), FailureConverter.BASE);
        var thr = assertFailed(f);
        assertThat(thr).isExactlyInstanceOf(HttpException.class).hasCause(ise);
    }

    @Test
    void failure_isUnwrappedBeforeConversion() {
        var ise = new IllegalStateException();
        var converter = mock(FailureConverter.class);
        var converted = new HttpException(503, null);
        when(converter.convert(any())).thenReturn(converted);
        var f = NormalizedFuture.of(
                CompletableFuture.failedFuture(new CompletionException(ise)), converter);
        assertThat(assertFailed(f)).isSameAs(converted);
        verify(converter).convert(ise);
    }

    @Test
    void converterThrows() {
        var ise = new IllegalStateException();
        var oops = new UnsupportedOperationException();
        FailureConverter converter = thr -> { throw oops; };
        var f = NormalizedFuture.of(CompletableFuture.failedFuture(ise), converter);
        assertThat(assertFailed(f)).isSameAs(oops);
        assertThat(oops.getSuppressed()).containsExactly(ise);
    }

    @Test
    void nullResponse_fails() {
        var f = NormalizedFuture.of(CompletableFuture.completedFuture(null), FailureConverter.BASE);
        var thr = assertFailed(f);
        assertThat(thr).isExactlyInstanceOf(HttpException.class)
                       .hasCauseExactlyInstanceOf(NullPointerException.class);
    }

    @Test
    void pending() {
        var src = new CompletableFuture<Response>();
        var f = NormalizedFuture.of(src, FailureConverter.BASE);
        assertThat(f).isNotDone();
        src.complete(Responses.noContent());
        assertThat(assertSucceeded(f).statusCode()).isEqualTo(204);
    }

    @Test
    void cancel_propagates() {
        var src = new CompletableFuture<Response>();
        var f = NormalizedFuture.of(src, FailureConverter.BASE);
        assertThat(f.cancel(true)).isTrue();
        assertThat(src).isCancelled();
        assertThat(f).isCancelled();
    }

    @Test
    void cancel_sourceNotSupportingIt() {
        @SuppressWarnings("unchecked")
        CompletionStage<Response> src = mock(CompletionStage.class);
        when(src.toCompletableFuture()).thenThrow(new UnsupportedOperationException());
        var f = NormalizedFuture.of(src, FailureConverter.BASE);
        assertThat(f.cancel(false)).isTrue();
    }
}

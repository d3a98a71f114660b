package org.javai.deltashare.endpoint;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLHandshakeException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class EndpointValidatorTest {

    private List<String> resolvedHosts;
    private List<URI> probedTargets;
    private HostResolver resolver;
    private ReachabilityProbe probe;

    @BeforeEach
    void setUp() {
        resolvedHosts = new ArrayList<>();
        probedTargets = new ArrayList<>();
        resolver = host -> {
            resolvedHosts.add(host);
            return List.of(InetAddress.getByAddress(host, new byte[]{10, 0, 0, 1}));
        };
        probe = probedTargets::add;
    }

    private EndpointValidator validator() {
        return new EndpointValidator(EnumSet.allOf(CloudProvider.class), resolver, probe);
    }

    @Test
    void httpsAwsWorkspace_isAccepted() throws Exception {
        Destination destination = validator().validate("https://foo.cloud.databricks.com");

        assertThat(destination.scheme()).isEqualTo("https");
        assertThat(destination.host()).isEqualTo("foo.cloud.databricks.com");
        assertThat(destination.provider()).isEqualTo(CloudProvider.AWS);
        assertThat(destination.rawAddress()).isEqualTo("https://foo.cloud.databricks.com");
        assertThat(resolvedHosts).containsExactly("foo.cloud.databricks.com");
        assertThat(probedTargets).containsExactly(URI.create("https://foo.cloud.databricks.com/"));
    }

    @Test
    void azureAndGcpWorkspaces_areAccepted() throws Exception {
        assertThat(validator().validate("https://adb-123.4.azuredatabricks.net/").provider())
                .isEqualTo(CloudProvider.AZURE);
        assertThat(validator().validate("https://1234.5.gcp.databricks.com").provider())
                .isEqualTo(CloudProvider.GCP);
    }

    @Test
    void hostMatching_isCaseInsensitive() throws Exception {
        Destination destination = validator().validate("https://Foo.Cloud.Databricks.COM");

        assertThat(destination.host()).isEqualTo("foo.cloud.databricks.com");
    }

    @Test
    void pathAndQuery_areKept_probeTargetsOrigin() throws Exception {
        Destination destination = validator().validate("https://adb-1.2.azuredatabricks.net/?o=1");

        assertThat(destination.uri().getQuery()).isEqualTo("o=1");
        assertThat(probedTargets).containsExactly(URI.create("https://adb-1.2.azuredatabricks.net/"));
    }

    @Test
    void httpScheme_isInvalid() {
        assertThatThrownBy(() -> validator().validate("http://foo.cloud.databricks.com"))
                .isInstanceOf(InvalidEndpointException.class)
                .hasMessageContaining("https");
        assertThat(resolvedHosts).isEmpty();
        assertThat(probedTargets).isEmpty();
    }

    @Test
    void unknownDomain_isInvalid() {
        assertThatThrownBy(() -> validator().validate("https://evil.example.com"))
                .isInstanceOf(InvalidEndpointException.class)
                .hasMessageContaining("evil.example.com");
        assertThat(probedTargets).isEmpty();
    }

    @Test
    void lookalikeDomains_areInvalid() {
        assertThatThrownBy(() -> validator().validate("https://foo.cloud.databricks.com.evil.io"))
                .isInstanceOf(InvalidEndpointException.class);
        assertThatThrownBy(() -> validator().validate("https://evilcloud.databricks.com"))
                .isInstanceOf(InvalidEndpointException.class);
        assertThatThrownBy(() -> validator().validate("https://azuredatabricks.net"))
                .isInstanceOf(InvalidEndpointException.class);
    }

    @Test
    void userInfo_isInvalid() {
        assertThatThrownBy(() -> validator().validate("https://evil.com@foo.cloud.databricks.com"))
                .isInstanceOf(InvalidEndpointException.class)
                .hasMessageContaining("user info");
    }

    @Test
    void nonStandardPort_isInvalid() {
        assertThatThrownBy(() -> validator().validate("https://foo.cloud.databricks.com:8443"))
                .isInstanceOf(InvalidEndpointException.class)
                .hasMessageContaining("443");
    }

    @Test
    void explicitPort443_isAccepted() throws Exception {
        assertThat(validator().validate("https://foo.cloud.databricks.com:443").host())
                .isEqualTo("foo.cloud.databricks.com");
    }

    @Test
    void blankOrUnparseable_isInvalid() {
        assertThatThrownBy(() -> validator().validate(null)).isInstanceOf(InvalidEndpointException.class);
        assertThatThrownBy(() -> validator().validate("   ")).isInstanceOf(InvalidEndpointException.class);
        assertThatThrownBy(() -> validator().validate("https://foo bar.cloud.databricks.com"))
                .isInstanceOf(InvalidEndpointException.class);
        assertThatThrownBy(() -> validator().validate("foo.cloud.databricks.com"))
                .isInstanceOf(InvalidEndpointException.class)
                .hasMessageContaining("absolute");
    }

    @Test
    void providerNotAccepted_isInvalid() {
        EndpointValidator azureOnly = new EndpointValidator(EnumSet.of(CloudProvider.AZURE), resolver, probe);

        assertThatThrownBy(() -> azureOnly.validate("https://foo.cloud.databricks.com"))
                .isInstanceOf(InvalidEndpointException.class);
    }

    @Test
    void dnsFailure_isUnreachable() {
        resolver = host -> {
            throw new UnknownHostException(host);
        };

        assertThatThrownBy(() -> validator().validate("https://unreachable.azuredatabricks.net"))
                .isInstanceOf(EndpointUnreachableException.class)
                .extracting(e -> ((EndpointUnreachableException) e).reason())
                .isEqualTo(UnreachableReason.DNS_RESOLUTION_FAILED);
        assertThat(probedTargets).isEmpty();
    }

    @Test
    void stalledResolution_timesOut_andCancelsLookup() throws InterruptedException {
        CountDownLatch neverAnswers = new CountDownLatch(1);
        CountDownLatch lookupCancelled = new CountDownLatch(1);
        resolver = host -> {
            try {
                neverAnswers.await();
            } catch (InterruptedException e) {
                lookupCancelled.countDown();
                Thread.currentThread().interrupt();
            }
            throw new UnknownHostException(host);
        };
        EndpointValidator validator = new EndpointValidator(EnumSet.allOf(CloudProvider.class), resolver, probe,
                Duration.ofMillis(200));

        try {
            long started = System.nanoTime();
            assertThatThrownBy(() -> validator.validate("https://blackholed.azuredatabricks.net"))
                    .isInstanceOf(EndpointUnreachableException.class)
                    .hasMessageContaining("timed out")
                    .extracting(e -> ((EndpointUnreachableException) e).reason())
                    .isEqualTo(UnreachableReason.TIMED_OUT);
            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
            assertThat(lookupCancelled.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(probedTargets).isEmpty();
        } finally {
            neverAnswers.countDown();
        }
    }

    @Test
    void nonPositiveResolveTimeout_isRejected() {
        assertThatThrownBy(() -> new EndpointValidator(EnumSet.allOf(CloudProvider.class), resolver, probe,
                Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyResolution_isUnreachable() {
        resolver = host -> List.of();

        assertThatThrownBy(() -> validator().validate("https://unreachable.azuredatabricks.net"))
                .isInstanceOf(EndpointUnreachableException.class)
                .extracting(e -> ((EndpointUnreachableException) e).reason())
                .isEqualTo(UnreachableReason.DNS_RESOLUTION_FAILED);
    }

    @Test
    void probeTimeout_isUnreachable() {
        probe = target -> {
            throw new HttpTimeoutException("request timed out");
        };

        assertThatThrownBy(() -> validator().validate("https://unreachable.azuredatabricks.net"))
                .isInstanceOf(EndpointUnreachableException.class)
                .hasMessageContaining("timed out")
                .extracting(e -> ((EndpointUnreachableException) e).reason())
                .isEqualTo(UnreachableReason.TIMED_OUT);
    }

    @Test
    void connectTimeout_isUnreachableTimedOut() {
        probe = target -> {
            throw new HttpConnectTimeoutException("connect timed out");
        };

        assertThatThrownBy(() -> validator().validate("https://unreachable.azuredatabricks.net"))
                .extracting(e -> ((EndpointUnreachableException) e).reason())
                .isEqualTo(UnreachableReason.TIMED_OUT);
    }

    @Test
    void probeFailures_mapToReasons() {
        assertThat(reasonFor(new ConnectException("Connection refused"))).isEqualTo(UnreachableReason.CONNECTION_REFUSED);
        assertThat(reasonFor(new SSLHandshakeException("bad cert"))).isEqualTo(UnreachableReason.TLS_FAILURE);
        assertThat(reasonFor(new IOException("connection reset"))).isEqualTo(UnreachableReason.PROBE_FAILED);
    }

    @Test
    void interruptedProbe_isUnreachable_andKeepsInterruptFlag() {
        probe = target -> {
            throw new InterruptedException();
        };

        try {
            assertThatThrownBy(() -> validator().validate("https://foo.cloud.databricks.com"))
                    .isInstanceOf(EndpointUnreachableException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void sameAddressTwice_isValidatedTwice() throws Exception {
        EndpointValidator validator = validator();

        validator.validate("https://foo.cloud.databricks.com");
        validator.validate("https://foo.cloud.databricks.com");

        assertThat(resolvedHosts).hasSize(2);
        assertThat(probedTargets).hasSize(2);
    }

    @Test
    void parse_doesNoNetworkAccess() throws Exception {
        Destination destination = validator().parse("https://foo.cloud.databricks.com");

        assertThat(destination.provider()).isEqualTo(CloudProvider.AWS);
        assertThat(resolvedHosts).isEmpty();
        assertThat(probedTargets).isEmpty();
    }

    @Test
    void emptyProviderSet_isRejected() {
        assertThatThrownBy(() -> new EndpointValidator(EnumSet.noneOf(CloudProvider.class), resolver, probe))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private UnreachableReason reasonFor(IOException failure) {
        EndpointValidator validator = new EndpointValidator(EnumSet.allOf(CloudProvider.class), resolver,
                target -> {
                    throw failure;
                });
        try {
            validator.validate("https://foo.cloud.databricks.com");
        } catch (EndpointUnreachableException e) {
            return e.reason();
        } catch (InvalidEndpointException e) {
            throw new AssertionError("unexpected rejection", e);
        }
        throw new AssertionError("expected the probe failure to be reported");
    }
}

package org.drinkmap.node.processes.driver;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.drinkmap.driver.DriverState;
import org.drinkmap.driver.IDriver;
import org.drinkmap.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class DriverContainerProcessTest {

    private static final String ECHO_DRIVER = "org.drinkmap.node.processes.driver.DriverContainerProcessTest$EchoDriver";

    private DriverContainerProcess process;

    @AfterEach
    void tearDown() {
        if (process != null) {
            process.stop();
        }
        EchoDriver.CLEANUPS.set(0);
    }

    private static DriverContainerProcess create(final String options) {
        return new DriverContainerProcess("drivers", Map.of(), ConfigFactory.parseString(options));
    }

    public static class EchoDriver implements IDriver<String> {
        static final AtomicInteger CLEANUPS = new AtomicInteger();

        @Override
        public String initialize(final Config options) {
            return options.hasPath("greeting") ? options.getString("greeting") : "hello";
        }

        @Override
        public void cleanup(final String instance) {
            CLEANUPS.incrementAndGet();
        }

        @Override
        public boolean healthCheck(final String instance) {
            return true;
        }
    }

    @Test
    void defaultDriversAreRegisteredLazily() {
        process = create("");

        assertThat(process.getContainer().getRegisteredNames()).contains("http", "storage", "mongo");
        assertThat(process.getContainer().getState("mongo")).isEqualTo(DriverState.REGISTERED);
        assertThat(process.getExposedService()).isSameAs(process.getContainer());
    }

    @Test
    void driversCanBeRegisteredByClassName() {
        process = create("register { echo = \"" + ECHO_DRIVER + "\" }\n"
            + "drivers { echo { greeting = \"hi\" } }\n"
            + "eager = [echo]");

        assertThat(process.getContainer().getRegisteredNames()).contains("echo");
        assertThat(process.getContainer().getState("echo")).isEqualTo(DriverState.REGISTERED);

        process.start();

        assertThat(process.getContainer().getState("echo")).isEqualTo(DriverState.READY);
        assertThat(process.getContainer().getInstance("echo", String.class)).isEqualTo("hi");

        process.stop();
        process = null;
        assertThat(EchoDriver.CLEANUPS.get()).isEqualTo(1);
    }

    @Test
    void registeredClassMustImplementTheDriverInterface() {
        assertThatThrownBy(() -> create("register { echo = \"java.lang.String\" }"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("does not implement IDriver");
    }

    @Test
    void unknownDriverClassIsRejected() {
        assertThatThrownBy(() -> create("register { echo = \"org.drinkmap.DoesNotExist\" }"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be created")
            .hasRootCauseInstanceOf(ClassNotFoundException.class);
    }

    @Test
    void eagerNamesMustBeRegistered() {
        assertThatThrownBy(() -> create("eager = [ghost]"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("ghost");
    }
}

package com.phillippitts.videoconverter.service.process;

import com.phillippitts.videoconverter.exception.ProcessSignalException;
import com.phillippitts.videoconverter.testutil.FakeProcess;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OsProcessHandleTest {

    @Test
    void gracefulSignalDestroysLiveProcess() throws Exception {
        FakeProcess process = new FakeProcess("", "", 0, true, true);
        OsProcessHandle handle = new OsProcessHandle(process);

        handle.signalGraceful();

        assertThat(process.wasDestroyCalled()).isTrue();
        assertThat(process.wasDestroyForciblyCalled()).isFalse();
        assertThat(process.isAlive()).isFalse();
    }

    @Test
    void gracefulSignalOnExitedProcessReportsAlreadyExited() {
        OsProcessHandle handle = new OsProcessHandle(new FakeProcess("", "", 0, false, true));

        assertThatThrownBy(handle::signalGraceful)
                .isInstanceOf(ProcessSignalException.class)
                .satisfies(e -> assertThat(((ProcessSignalException) e).isAlreadyExited()).isTrue());
    }

    @Test
    void gracefulSignalFailsWithoutNormalTermination() {
        FakeProcess process = new FakeProcess("", "", 0, true, false);
        OsProcessHandle handle = new OsProcessHandle(process);

        assertThatThrownBy(handle::signalGraceful)
                .isInstanceOf(ProcessSignalException.class)
                .hasMessageContaining("not supported")
                .hasMessageContaining("pid: " + FakeProcess.FAKE_PID)
                .satisfies(e -> assertThat(((ProcessSignalException) e).isAlreadyExited()).isFalse());
        assertThat(process.wasDestroyCalled()).isFalse();
    }

    @Test
    void forcefulSignalKillsProcess() throws Exception {
        FakeProcess process = new FakeProcess("", "", 0, true, false);
        OsProcessHandle handle = new OsProcessHandle(process);

        handle.signalForceful();

        assertThat(process.wasDestroyForciblyCalled()).isTrue();
    }

    @Test
    void forcefulSignalOnExitedProcessReportsAlreadyExited() {
        OsProcessHandle handle = new OsProcessHandle(new FakeProcess("", "", 0));

        assertThatThrownBy(handle::signalForceful)
                .isInstanceOf(ProcessSignalException.class)
                .satisfies(e -> assertThat(((ProcessSignalException) e).isAlreadyExited()).isTrue());
    }

    @Test
    void exposesPid() {
        assertThat(new OsProcessHandle(new FakeProcess("", "", 0)).pid()).isEqualTo(FakeProcess.FAKE_PID);
    }
}

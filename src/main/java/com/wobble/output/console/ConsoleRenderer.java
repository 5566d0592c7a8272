package com.wobble.output.console;

import com.wobble.core.events.RunFinished;
import com.wobble.core.events.RunStarted;
import com.wobble.core.events.TestFinished;
import com.wobble.core.events.TestStarted;

/**
 * One console rendering strategy. Each callback prints straight away unless the strategy buffers.
 */
interface ConsoleRenderer {

    void runStarted(RunStarted event);

    void testStarted(TestStarted event);

    void testFinished(TestFinished event);

    void runFinished(RunFinished event);
}

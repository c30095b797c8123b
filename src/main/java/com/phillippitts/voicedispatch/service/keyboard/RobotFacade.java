package com.phillippitts.voicedispatch.service.keyboard;

import java.awt.AWTException;
import java.awt.Robot;

/**
 * Minimal view of {@link Robot} so tests can record key events without a display.
 */
interface RobotFacade {

    void keyPress(int keyCode);

    void keyRelease(int keyCode);

    /** Supplies a facade, or fails when synthetic input is not permitted. */
    @FunctionalInterface
    interface Provider {
        RobotFacade create() throws AWTException;
    }

    final class AwtRobotFacade implements RobotFacade {
        private final Robot robot;

        AwtRobotFacade() throws AWTException {
            this.robot = new Robot();
        }

        @Override
        public void keyPress(int keyCode) {
            robot.keyPress(keyCode);
        }

        @Override
        public void keyRelease(int keyCode) {
            robot.keyRelease(keyCode);
        }
    }
}

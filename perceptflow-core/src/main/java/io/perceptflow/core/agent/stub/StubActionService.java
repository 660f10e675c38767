package io.perceptflow.core.agent.stub;

import io.perceptflow.core.collaborator.ActionDescriptor;
import io.perceptflow.core.collaborator.ActionOutcome;
import io.perceptflow.core.collaborator.ActionService;
import io.perceptflow.core.collaborator.CollaboratorException;
import java.util.ArrayList;
import java.util.List;

/// Action service that records actions instead of performing them.
///
/// Pointer coordinates outside the configured screen are rejected as out of bounds.
public final class StubActionService implements ActionService {

    private final int screenWidth;
    private final int screenHeight;
    private final List<ActionDescriptor> performed = new ArrayList<>();

    public StubActionService() {
        this(1920, 1080);
    }

    public StubActionService(int screenWidth, int screenHeight) {
        this.screenWidth = screenWidth;
        this.screenHeight = screenHeight;
    }

    @Override
    public synchronized ActionOutcome execute(ActionDescriptor action)
            throws CollaboratorException {
        checkBounds(action.x(), action.y());
        checkBounds(action.toX(), action.toY());
        performed.add(action);
        return ActionOutcome.succeeded("simulated " + action.describe());
    }

    /// Returns the actions performed so far, in order.
    public synchronized List<ActionDescriptor> performed() {
        return List.copyOf(performed);
    }

    private void checkBounds(Integer x, Integer y) throws CollaboratorException {
        if (x == null || y == null) {
            return;
        }
        if (x < 0 || y < 0 || x >= screenWidth || y >= screenHeight) {
            throw new CollaboratorException(
                    CollaboratorException.Reason.OUT_OF_BOUNDS,
                    "Coordinates (" + x + ", " + y + ") are outside the "
                            + screenWidth + "x" + screenHeight + " screen");
        }
    }
}

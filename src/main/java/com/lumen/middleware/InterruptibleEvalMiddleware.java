package com.lumen.middleware;

import com.lumen.eval.EvaluationEngine;
import com.lumen.eval.EvaluationResult;
import com.lumen.protocol.Message;
import com.lumen.protocol.Responses;
import com.lumen.protocol.Status;
import com.lumen.protocol.Transport;
import com.lumen.session.InterruptOutcome;
import com.lumen.session.Session;
import com.lumen.session.Task;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Serves {@code eval} by queueing an evaluation task on the request's session, and
 * {@code interrupt} by signalling the session's running task.
 *
 * A task's trailing {@code done} is sent only if the task was not interrupted; an
 * interrupt that wins sends the task's terminal {@code [interrupted, done]} itself, so a
 * task never gets both.
 */
public final class InterruptibleEvalMiddleware implements Middleware {

    public static final String NAME = "interruptible-eval";

    private static final Descriptor DESCRIPTOR = Descriptor.builder(NAME)
            .requires("clone", "close")
            .handles("eval", new OpDoc(
                    "Evaluates code.",
                    SessionMiddleware.map(
                            "code", "The code to be evaluated.",
                            "session", "The ID of the session within which to evaluate the code."),
                    SessionMiddleware.map(
                            "id", "An opaque message ID that will be included in responses related to the evaluation, and which may be used to restrict the scope of a later \"interrupt\" operation.",
                            "ns", "The namespace to evaluate in, for this request only.",
                            "eval", "A fully-qualified symbol naming a var whose function value will be used to evaluate [code].",
                            "file", "The path to the file containing [code].",
                            "line", "The line number in [file] at which [code] starts.",
                            "column", "The column number in [file] at which [code] starts."),
                    SessionMiddleware.map(
                            "ns", "*ns*, after successful evaluation of `code`.",
                            "value", "The result of evaluating a form of `code`, printed readably.",
                            "ex", "The type of exception thrown, if any. If present, then `value` will be absent.",
                            "root-ex", "The type of the root exception thrown, if any.")))
            .handles("interrupt", new OpDoc(
                    "Attempts to interrupt some code evaluation.",
                    SessionMiddleware.map("session", "The ID of the session used to start the evaluation to be interrupted."),
                    SessionMiddleware.map("interrupt-id", "The opaque message ID sent with the original \"eval\" request."),
                    SessionMiddleware.map("status",
                            "'interrupted' if an evaluation was identified and interruption will be attempted, "
                                    + "'session-idle' if the session is not currently evaluating any code, "
                                    + "'interrupt-id-mismatch' if the session is currently evaluating code sent using a different ID than specified by the \"interrupt-id\" value")))
            .build();

    private final EvaluationEngine engine;

    public InterruptibleEvalMiddleware(EvaluationEngine engine) {
        if (engine == null) throw new IllegalArgumentException("engine is null");
        this.engine = engine;
    }

    @Override
    public Descriptor descriptor() { return DESCRIPTOR; }

    @Override
    public Handler wrap(Handler next) {
        return request -> {
            String op = request.op();
            if ("eval".equals(op)) {
                eval(request);
            } else if ("interrupt".equals(op)) {
                interrupt(request);
            } else {
                next.handle(request);
            }
        };
    }

    private void eval(Request request) {
        Message msg = request.message();
        Session session = request.session();
        if (session == null) {
            request.reply(Status.ERROR, Status.UNKNOWN_SESSION, Status.DONE);
            return;
        }
        if (!msg.has("code")) {
            request.reply(Status.ERROR, Status.NO_CODE, Status.DONE);
            return;
        }

        Transport transport = request.transport();
        AtomicBoolean terminalSent = new AtomicBoolean(false);
        session.submit(new Task(msg.id(), session,
                token -> {
                    redirectOutput(session, transport, msg);
                    EvaluationResult result = engine.evaluate(session.bindings(), msg, transport, token);
                    session.setBindings(result.bindings());
                    terminalSent.set(result.terminalSent());
                },
                () -> {
                    if (!terminalSent.get()) request.reply(Status.DONE);
                },
                () -> request.reply(Status.SESSION_CLOSED, Status.DONE)));
    }

    private void interrupt(Request request) {
        Message msg = request.message();
        Session session = request.session();
        if (session == null) {
            request.reply(Status.ERROR, Status.UNKNOWN_SESSION, Status.DONE);
            return;
        }

        InterruptOutcome outcome = session.interruptSlot().interrupt(msg.getString("interrupt-id"));
        switch (outcome.kind()) {
            case NO_MATCH:
                request.reply(Status.ERROR, Status.INTERRUPT_ID_MISMATCH, Status.DONE);
                break;
            case IDLE:
                request.reply(Status.SESSION_IDLE, Status.DONE);
                break;
            case INTERRUPTED:
            default:
                // Terminal message of the interrupted eval; its own done is suppressed.
                request.send(Message.builder()
                        .put(Message.ID, outcome.taskId())
                        .put(Message.SESSION, session.id())
                        .put(Message.STATUS, Responses.status(Status.INTERRUPTED, Status.DONE))
                        .build());
                request.send(Responses.responseFor(msg)
                        .put(Message.STATUS, Responses.status(Status.INTERRUPTED, Status.DONE))
                        .put("interrupted-id", outcome.taskId())
                        .build());
                break;
        }
    }

    private static void redirectOutput(Session session, Transport transport, Message msg) {
        try {
            session.out().redirect(transport, msg);
            session.err().redirect(transport, msg);
            session.in().redirect(transport, msg);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

package dk.cloudcreate.essentials.components.common.correlation;

import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Builds correlated messages from a freshly derived {@link CorrelationEnvelope}.<br>
 * Example:
 * <pre>{@code
 * var createAccount = MessageBuilder.newMessage(envelope -> new CreateAccount(envelope, accountId));
 * var accountCreated = MessageBuilder.from(createAccount, envelope -> new AccountCreated(envelope, accountId));
 * }</pre>
 */
public final class MessageBuilder {
    private MessageBuilder() {
    }

    /**
     * Build a message that starts a new correlation chain
     *
     * @param builder function that creates the message from the envelope
     * @param <M>     the message type
     * @return the message created by the <code>builder</code>
     */
    public static <M extends CorrelatedMessage> M newMessage(Function<CorrelationEnvelope, M> builder) {
        requireNonNull(builder, "You must supply a message builder");
        return builder.apply(CorrelationEnvelope.newChain());
    }

    /**
     * Build a message caused by <code>source</code>
     *
     * @param source  the message that causes the new message
     * @param builder function that creates the message from the derived envelope
     * @param <M>     the message type
     * @return the message created by the <code>builder</code>
     */
    public static <M extends CorrelatedMessage> M from(CorrelatedMessage source, Function<CorrelationEnvelope, M> builder) {
        requireNonNull(source, "You must supply a source message");
        requireNonNull(builder, "You must supply a message builder");
        return builder.apply(CorrelationEnvelope.from(source));
    }
}

package in.launchkit.application.port.output;

public interface XGateway {

    /**
     * Post a status update.
     *
     * @param replyToId parent post id, or null for a top-level post
     * @return id of the new post
     */
    String post(String text, String replyToId);
}

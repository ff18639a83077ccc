package in.launchkit.application.port.output;

/**
 * External text-generation collaborator. May throw or return blank; callers fall back.
 */
public interface TextGenerator {

    String generate(String prompt);
}

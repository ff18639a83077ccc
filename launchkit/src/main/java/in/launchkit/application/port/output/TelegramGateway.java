package in.launchkit.application.port.output;

public interface TelegramGateway {

    /**
     * @return id of the sent message
     */
    long sendMessage(String chatId, String text);

    void pinMessage(String chatId, long messageId);
}

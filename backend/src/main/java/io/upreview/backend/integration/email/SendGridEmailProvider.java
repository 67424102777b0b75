package io.upreview.backend.integration.email;

import com.sendgrid.Method;
import com.sendgrid.Request;
import com.sendgrid.Response;
import com.sendgrid.SendGrid;
import com.sendgrid.helpers.mail.Mail;
import com.sendgrid.helpers.mail.objects.Content;
import com.sendgrid.helpers.mail.objects.Email;
import com.sendgrid.helpers.mail.objects.Personalization;
import java.io.IOException;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * SendGrid-based email provider. Message metadata is copied to SendGrid custom args so delivery
 * events can be traced back to a business and recipient.
 */
@Component
@ConditionalOnProperty(name = "upreview.email.provider", havingValue = "sendgrid")
public class SendGridEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(SendGridEmailProvider.class);

  private final String apiKey;
  private final Function<String, SendGrid> sendGridFactory;

  @Autowired
  public SendGridEmailProvider(EmailProperties properties) {
    this(properties.sendgridApiKey(), SendGrid::new);
  }

  SendGridEmailProvider(String apiKey, Function<String, SendGrid> sendGridFactory) {
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalStateException(
          "upreview.email.sendgrid-api-key must be configured for the sendgrid provider");
    }
    this.apiKey = apiKey;
    this.sendGridFactory = sendGridFactory;
  }

  @Override
  public String providerId() {
    return "sendgrid";
  }

  @Override
  public SendResult sendEmail(EmailMessage message) {
    try {
      return send(buildMail(message));
    } catch (IOException e) {
      log.error("Failed to send SendGrid email to {}: {}", message.to(), e.getMessage());
      return new SendResult(false, null, e.getMessage());
    }
  }

  private Mail buildMail(EmailMessage message) {
    message.requireBody();

    Personalization personalization = new Personalization();
    personalization.addTo(new Email(message.to()));
    message.metadata().forEach(personalization::addCustomArg);

    Mail mail = new Mail();
    mail.setFrom(new Email(message.fromAddress(), message.fromName()));
    mail.setSubject(message.subject());
    mail.addPersonalization(personalization);

    if (message.plainTextBody() != null) {
      mail.addContent(new Content("text/plain", message.plainTextBody()));
    }
    if (message.htmlBody() != null) {
      mail.addContent(new Content("text/html", message.htmlBody()));
    }
    return mail;
  }

  private SendResult send(Mail mail) throws IOException {
    SendGrid sg = sendGridFactory.apply(apiKey);
    Request request = new Request();
    request.setMethod(Method.POST);
    request.setEndpoint("mail/send");
    request.setBody(mail.build());

    Response response = sg.api(request);
    int status = response.getStatusCode();

    if (status >= 200 && status < 300) {
      String sgMessageId = response.getHeaders().get("X-Message-Id");
      log.debug("SendGrid email sent, sg_message_id: {}", sgMessageId);
      return new SendResult(true, sgMessageId, null);
    }
    String errorBody = response.getBody();
    log.error("SendGrid API returned {}: {}", status, errorBody);
    return new SendResult(false, null, "SendGrid API error " + status + ": " + errorBody);
  }
}

package io.upreview.backend.invitation;

import io.upreview.backend.business.EmailTemplate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * Renders a business's email template for one customer. Every {@code [customer]} placeholder
 * (case-insensitive) in subject and body is replaced with the customer's name.
 */
@Component
public class InvitationEmailComposer {

  static final String DEFAULT_CUSTOMER_NAME = "Customer";
  private static final Pattern CUSTOMER_PLACEHOLDER =
      Pattern.compile("\\[customer]", Pattern.CASE_INSENSITIVE);

  private static final String HTML_TEMPLATE =
      """
      <div style="background-color:#f4f4f5;padding:24px 0;">
        <table width="100%%" cellpadding="0" cellspacing="0" role="presentation">
          <tr>
            <td align="center">
              <table width="600" cellpadding="0" cellspacing="0" role="presentation" \
      style="background-color:#ffffff;border-radius:12px;padding:32px;\
      font-family:system-ui,sans-serif;color:#111827;">
                <tr>
                  <td align="center" style="padding-bottom:24px;font-size:18px;font-weight:600;">
                    %1$s
                  </td>
                </tr>
                <tr>
                  <td style="font-size:16px;line-height:1.6;">
                    <p style="margin:0 0 12px 0;">Hi %2$s,</p>
                    <p style="margin:0 0 16px 0;">%3$s</p>
                  </td>
                </tr>
                <tr>
                  <td align="center" style="padding:24px 0 16px 0;">
                    <a href="%4$s" style="background:#16a34a;color:#ffffff;padding:12px 24px;\
      text-decoration:none;font-weight:bold;border-radius:6px;display:inline-block;\
      margin-right:12px;">Happy</a>
                    <a href="%5$s" style="background:#dc2626;color:#ffffff;padding:12px 24px;\
      text-decoration:none;font-weight:bold;border-radius:6px;display:inline-block;">Unsatisfied</a>
                  </td>
                </tr>
                <tr>
                  <td style="font-size:14px;line-height:1.6;color:#6b7280;padding-top:8px;">
                    <p style="margin:0;">Best regards,<br />%1$s</p>
                  </td>
                </tr>
              </table>
              <div style="font-size:11px;color:#9ca3af;padding-top:12px;">
                If you received this email in error, you can safely ignore it.
              </div>
            </td>
          </tr>
        </table>
      </div>
      """;

  private static final String TEXT_TEMPLATE =
      """
      Hi %2$s,

      %3$s

      Please let us know how we went:

      Happy: %4$s
      Unsatisfied: %5$s

      Best regards,
      %1$s
      """;

  /**
   * @param companyName sender display name shown in the greeting and signature
   * @param customerName recipient display name; blank falls back to "Customer"
   * @param template stored or default template
   * @param links good and bad review links
   */
  public ComposedEmail compose(
      String companyName, String customerName, EmailTemplate template, ReviewLinks links) {
    String name =
        customerName == null || customerName.isBlank()
            ? DEFAULT_CUSTOMER_NAME
            : customerName.trim();
    String subject = personalise(template.subjectOrDefault(), name);
    String body = personalise(template.bodyOrDefault(), name);

    String text =
        TEXT_TEMPLATE.formatted(companyName, name, body, links.goodHref(), links.badHref());
    String html =
        HTML_TEMPLATE
            .formatted(
                HtmlUtils.htmlEscape(companyName),
                HtmlUtils.htmlEscape(name),
                nl2br(body),
                HtmlUtils.htmlEscape(links.goodHref()),
                HtmlUtils.htmlEscape(links.badHref()))
            .strip();
    return new ComposedEmail(subject, html, text);
  }

  static String personalise(String text, String customerName) {
    return CUSTOMER_PLACEHOLDER.matcher(text).replaceAll(Matcher.quoteReplacement(customerName));
  }

  private static String nl2br(String text) {
    return HtmlUtils.htmlEscape(text).replace("\r\n", "\n").replace("\n", "<br>");
  }
}

/*
 * Where: Court alert dispatch
 * What: Sends digests as plain-text mail through Spring's JavaMailSender
 */
package com.example.courtalert.dispatch;

import com.example.courtalert.config.DispatchProperties;
import com.example.courtalert.model.Digest;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "court-alert.dispatch.mode", havingValue = "mail")
public class MailDigestDispatcher implements DigestDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(MailDigestDispatcher.class);

  private final JavaMailSender mailSender;
  private final DispatchProperties properties;
  private final DigestFormatter formatter;

  @Override
  public void sendDigest(Digest digest) {
    if (digest.recipient() == null || digest.recipient().isBlank()) {
      throw new DispatchException(
          digest.digestId(), "subscription has no recipient id=" + digest.subscription().id(), null);
    }
    if (properties.from() == null || properties.from().isBlank()) {
      throw new DispatchException(
          digest.digestId(), "court-alert.dispatch.from is not configured", null);
    }
    try {
      final MimeMessage message = mailSender.createMimeMessage();
      final MimeMessageHelper helper =
          new MimeMessageHelper(message, false, StandardCharsets.UTF_8.name());
      if (properties.fromName() != null && !properties.fromName().isBlank()) {
        helper.setFrom(properties.from(), properties.fromName());
      } else {
        helper.setFrom(properties.from());
      }
      helper.setTo(digest.recipient());
      helper.setSubject(formatter.subject(digest));
      helper.setText(formatter.body(digest), false);
      mailSender.send(message);
    } catch (MessagingException | UnsupportedEncodingException | MailException ex) {
      throw new DispatchException(digest.digestId(), "digest mail failed: " + ex.getMessage(), ex);
    }
    logger.info(
        "digest mailed digestId={} subscriptionId={} windows={}",
        digest.digestId(),
        digest.subscription().id(),
        digest.entries().size());
  }
}

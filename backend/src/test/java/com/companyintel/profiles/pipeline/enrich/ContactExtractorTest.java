package com.companyintel.profiles.pipeline.enrich;

import com.companyintel.profiles.pipeline.model.ContactInfo;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContactExtractorTest {
    private final ContactExtractor extractor = new ContactExtractor();

    @Test
    void prefersLinksOverTextPatterns() {
        String html = """
            <html><body>
              <a href="mailto:sales@acme.com?subject=Hi">Email</a>
              <a href="tel:+1-555-123-4567">Call</a>
              <a href="https://www.linkedin.com/company/acme">LinkedIn</a>
              <a href="https://twitter.com/acme">Twitter</a>
              <a href="https://github.com/acme">GitHub</a>
              <a href="https://facebook.com/acme">Facebook</a>
              <a href="https://twitter.com/other">Second twitter</a>
            </body></html>
            """;

        ContactInfo contact = extractor.extract(html, "Write to info@acme.com or call (555) 987-6543");

        assertThat(contact.email()).isEqualTo("sales@acme.com");
        assertThat(contact.phone()).isEqualTo("+1-555-123-4567");
        assertThat(contact.socialLinks().linkedin()).isEqualTo("https://www.linkedin.com/company/acme");
        assertThat(contact.socialLinks().twitter()).isEqualTo("https://twitter.com/acme");
        assertThat(contact.socialLinks().github()).isEqualTo("https://github.com/acme");
        assertThat(contact.socialLinks().facebook()).isEqualTo("https://facebook.com/acme");
    }

    @Test
    void fallsBackToTextAndSkipsPlaceholderEmails() {
        ContactInfo contact = extractor.extract(
            "<html><body><p>Contact</p></body></html>",
            "Reach you@example.com or hello@acme.io, phone (555) 987-6543 today"
        );

        assertThat(contact.email()).isEqualTo("hello@acme.io");
        assertThat(contact.phone()).contains("987-6543");
    }

    @Test
    void readsSchemaOrgAddress() {
        String html = """
            <div itemprop="address">
              <span itemprop="streetAddress">1 Main St</span>
              <span itemprop="addressLocality">Springfield</span>
              <span itemprop="addressCountry">US</span>
            </div>
            """;

        ContactInfo contact = extractor.extract(html, "");

        assertThat(contact.address().full()).isEqualTo("1 Main St");
        assertThat(contact.address().city()).isEqualTo("Springfield");
        assertThat(contact.address().country()).isEqualTo("US");
    }

    @Test
    void footerWithZipCodeBecomesAddress() {
        ContactInfo contact = extractor.extract(
            "<footer>Acme Inc, 500 Market Street, San Francisco, CA 94105</footer>",
            ""
        );

        assertThat(contact.address().full()).isEqualTo("Acme Inc, 500 Market Street, San Francisco, CA 94105");
        assertThat(contact.address().city()).isNull();
    }

    @Test
    void blankHtmlYieldsEmptyContact() {
        assertThat(extractor.extract("", "anything")).isEqualTo(ContactInfo.EMPTY);
    }
}

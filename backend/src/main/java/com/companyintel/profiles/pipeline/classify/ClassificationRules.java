package com.companyintel.profiles.pipeline.classify;

import java.util.List;

/**
 * Offline rule table. Declaration order is the tie-break priority for both sectors and
 * industries.
 */
public final class ClassificationRules {

    public static final List<SectorRule> DEFAULT = List.of(
        new SectorRule(
            "Technology",
            List.of("software", "saas", "cloud", "app", "platform", "tech", "digital", "ai", "ml", "data",
                "cyber", "it solutions", "computer", "programming", "web", "mobile", "api", "database", "server"),
            List.of(
                new IndustryRule("Software",
                    List.of("software", "saas", "application", "app development", "platform", "program"),
                    "7372", "Prepackaged Software"),
                new IndustryRule("IT Services",
                    List.of("consulting", "it services", "managed services", "support", "it consulting"),
                    "7371", "Computer Programming Services"),
                new IndustryRule("Cybersecurity",
                    List.of("security", "cyber", "encryption", "firewall", "protection", "antivirus"),
                    "7373", "Computer Integrated Systems Design"),
                new IndustryRule("Web Development",
                    List.of("web", "website", "web design", "web development", "frontend", "backend"),
                    "7371", "Computer Programming Services")
            )
        ),
        new SectorRule(
            "Financial Services",
            List.of("bank", "finance", "investment", "insurance", "trading", "wealth", "credit", "loan", "mortgage",
                "fintech", "payment", "accounting", "financial"),
            List.of(
                new IndustryRule("Banking",
                    List.of("bank", "savings", "checking", "deposit", "atm"),
                    "6020", "Commercial Banks"),
                new IndustryRule("Investment",
                    List.of("investment", "portfolio", "trading", "stocks", "securities", "broker"),
                    "6211", "Security Brokers & Dealers"),
                new IndustryRule("Insurance",
                    List.of("insurance", "coverage", "policy", "claims", "underwriting"),
                    "6311", "Life Insurance"),
                new IndustryRule("Accounting",
                    List.of("accounting", "bookkeeping", "tax", "audit", "cpa"),
                    "8721", "Accounting, Auditing & Bookkeeping")
            )
        ),
        new SectorRule(
            "Healthcare",
            List.of("health", "medical", "hospital", "clinic", "patient", "doctor", "nurse", "pharmaceutical",
                "biotech", "medicine", "care", "wellness", "therapy", "healthcare"),
            List.of(
                new IndustryRule("Healthcare Services",
                    List.of("hospital", "clinic", "patient care", "medical services", "healthcare"),
                    "8062", "General Medical & Surgical Hospitals"),
                new IndustryRule("Pharmaceuticals",
                    List.of("pharmaceutical", "drug", "medication", "pharmacy", "prescription"),
                    "2834", "Pharmaceutical Preparations"),
                new IndustryRule("Medical Devices",
                    List.of("medical device", "equipment", "diagnostic", "imaging", "surgical"),
                    "3841", "Surgical & Medical Instruments")
            )
        ),
        new SectorRule(
            "Retail",
            List.of("retail", "store", "shop", "ecommerce", "e-commerce", "marketplace", "buy", "sell", "products",
                "shopping", "merchant", "sales"),
            List.of(
                new IndustryRule("E-commerce",
                    List.of("ecommerce", "e-commerce", "online store", "marketplace", "shopping", "online shop"),
                    "5961", "Catalog & Mail-Order Houses"),
                new IndustryRule("Consumer Goods",
                    List.of("products", "goods", "merchandise", "consumer"),
                    "5399", "Miscellaneous General Merchandise Stores")
            )
        ),
        new SectorRule(
            "Manufacturing",
            List.of("manufacturing", "production", "factory", "industrial", "machinery", "equipment", "fabrication",
                "assembly", "manufacture"),
            List.of(
                new IndustryRule("Industrial Manufacturing",
                    List.of("manufacturing", "production", "assembly", "factory"),
                    "3569", "General Industrial Machinery")
            )
        ),
        new SectorRule(
            "Professional Services",
            List.of("consulting", "advisory", "professional services", "legal", "accounting", "marketing",
                "advertising", "design", "agency", "recruitment", "consulting firm"),
            List.of(
                new IndustryRule("Consulting",
                    List.of("consulting", "advisory", "strategy", "consultant"),
                    "8742", "Management Consulting Services"),
                new IndustryRule("Legal Services",
                    List.of("legal", "law", "attorney", "lawyer", "law firm"),
                    "8111", "Legal Services"),
                new IndustryRule("Marketing",
                    List.of("marketing", "advertising", "branding", "agency", "digital marketing"),
                    "7311", "Advertising Agencies"),
                new IndustryRule("Design",
                    List.of("design", "graphic", "creative", "branding", "ux", "ui"),
                    "7336", "Commercial Art & Graphic Design")
            )
        ),
        new SectorRule(
            "Education",
            List.of("education", "school", "university", "training", "learning", "course", "teaching", "e-learning",
                "academic", "tutor"),
            List.of(
                new IndustryRule("Educational Services",
                    List.of("education", "training", "learning", "school", "university"),
                    "8200", "Educational Services")
            )
        ),
        new SectorRule(
            "Real Estate",
            List.of("real estate", "property", "housing", "commercial property", "residential", "realtor", "broker"),
            List.of(
                new IndustryRule("Real Estate Services",
                    List.of("real estate", "property management", "realtor", "broker"),
                    "6531", "Real Estate Agents & Managers")
            )
        ),
        new SectorRule(
            "Transportation",
            List.of("transportation", "logistics", "shipping", "delivery", "freight", "trucking", "transport"),
            List.of(
                new IndustryRule("Logistics",
                    List.of("logistics", "shipping", "freight", "delivery"),
                    "4213", "Trucking, Except Local")
            )
        ),
        new SectorRule(
            "Hospitality",
            List.of("hotel", "restaurant", "hospitality", "travel", "tourism", "accommodation", "food service"),
            List.of(
                new IndustryRule("Hotels",
                    List.of("hotel", "accommodation", "lodging", "resort"),
                    "7011", "Hotels & Motels"),
                new IndustryRule("Restaurants",
                    List.of("restaurant", "dining", "food service", "cafe", "catering"),
                    "5812", "Eating Places")
            )
        )
    );

    private ClassificationRules() {
    }
}

package com.hiredoc.infrastructure.extraction.cv;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Curated technical terms found in free-form skill prose. Terms that are also ordinary
 * words (Go, Swift, Spring...) only match with their usual capitalization.
 */
final class TechTerms {

    private record Term(String canonical, Pattern pattern) {
    }

    private static final List<Term> TERMS = List.of(
            // Languages
            term("Python", "python"),
            term("JavaScript", "javascript"),
            term("TypeScript", "typescript"),
            term("Java", "java"),
            term("C++", "c\\+\\+"),
            term("C#", "c#"),
            exact("Go", "Go|Golang"),
            exact("Rust", "Rust"),
            exact("Ruby", "Ruby"),
            term("PHP", "php"),
            exact("Swift", "Swift"),
            term("Kotlin", "kotlin"),
            term("Scala", "scala"),
            term("SQL", "sql"),
            // Frameworks
            term("React", "react(?:\\.?js)?"),
            term("Angular", "angular"),
            term("Vue", "vue(?:\\.?js)?"),
            term("Node.js", "node\\.?js"),
            exact("Express", "Express(?:\\.js)?"),
            term("Django", "django"),
            term("Flask", "flask"),
            term("FastAPI", "fastapi"),
            exact("Spring", "Spring(?: Boot)?"),
            // Cloud and tooling
            term("AWS", "aws|amazon web services"),
            term("GCP", "gcp|google cloud(?: platform)?"),
            term("Azure", "azure"),
            term("Docker", "docker"),
            term("Kubernetes", "kubernetes|k8s"),
            term("Terraform", "terraform"),
            term("CI/CD", "ci/cd"),
            term("Jenkins", "jenkins"),
            term("GitHub Actions", "github actions"),
            exact("Git", "Git|GIT"),
            term("Linux", "linux"),
            // Data stores
            term("PostgreSQL", "postgres(?:ql)?"),
            term("MySQL", "mysql"),
            term("MongoDB", "mongo(?:db)?"),
            term("Redis", "redis"),
            term("Elasticsearch", "elasticsearch"),
            term("DynamoDB", "dynamodb"),
            term("Kafka", "kafka"),
            // Data and AI
            term("Machine Learning", "machine learning|aprendizaje automatico|aprendizaje automático"),
            term("Deep Learning", "deep learning"),
            term("Data Science", "data science|ciencia de datos"),
            term("TensorFlow", "tensorflow"),
            term("PyTorch", "pytorch"),
            // Business tools
            exact("Excel", "Excel|EXCEL"),
            term("Power BI", "power bi"),
            term("Tableau", "tableau"),
            term("SAP", "sap"),
            term("Salesforce", "salesforce"),
            term("Scrum", "scrum")
    );

    private TechTerms() {
    }

    /**
     * Canonical names of the terms found, in order of first appearance.
     */
    static List<String> scan(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Map<String, Integer> firstSeen = new LinkedHashMap<>();
        for (Term term : TERMS) {
            Matcher m = term.pattern().matcher(text);
            if (m.find()) {
                firstSeen.merge(term.canonical(), m.start(), Math::min);
            }
        }
        List<Map.Entry<String, Integer>> hits = new ArrayList<>(firstSeen.entrySet());
        hits.sort(Map.Entry.comparingByValue());
        return hits.stream().map(Map.Entry::getKey).toList();
    }

    private static Term term(String canonical, String regex) {
        return new Term(canonical, Pattern.compile(bounded(regex), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }

    private static Term exact(String canonical, String regex) {
        return new Term(canonical, Pattern.compile(bounded(regex)));
    }

    private static String bounded(String regex) {
        return "(?<![\\p{L}\\p{N}_.+#/])(?:" + regex + ")(?![\\p{L}\\p{N}_+#]|\\.[\\p{L}])";
    }
}

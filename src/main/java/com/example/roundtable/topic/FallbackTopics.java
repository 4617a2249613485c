package com.example.roundtable.topic;

import com.example.roundtable.model.Topic;

import java.util.*;
import java.util.concurrent.ThreadLocalRandom;

/** Static topics used whenever the generator is unavailable. */
public final class FallbackTopics {

    private FallbackTopics() {}

    public static final String SOURCE = "fallback";

    private static final List<Topic> TOPICS = List.of(
            topic("The Future of Education",
                    "How will technology reshape learning in the next decade?",
                    "Education",
                    "What role should AI play in personalized learning?",
                    "How can we maintain human connection in digital education?",
                    "What skills will be most important for future students?"),
            topic("Sustainable Living in Urban Areas",
                    "Exploring practical ways to live more sustainably in cities.",
                    "Environment",
                    "What small changes can make the biggest environmental impact?",
                    "How can cities be redesigned for sustainability?",
                    "What role does individual responsibility play in climate change?"),
            topic("The Impact of Social Media on Society",
                    "Examining both positive and negative effects of social media platforms.",
                    "Technology",
                    "How has social media changed human relationships?",
                    "What are the benefits and drawbacks of constant connectivity?",
                    "How can we use social media more mindfully?"),
            topic("Mental Health and Well-being",
                    "Discussing strategies for maintaining good mental health in modern life.",
                    "Health",
                    "What practices contribute most to mental well-being?",
                    "How can we reduce stigma around mental health discussions?",
                    "What role does community play in supporting mental health?"),
            topic("The Future of Work",
                    "How is the nature of work changing with technology and remote work trends?",
                    "Career",
                    "What skills will be most valuable in the future job market?",
                    "How can we balance work-life integration?",
                    "What impact will AI have on different professions?"),
            topic("Cultural Diversity and Understanding",
                    "The importance of cultural exchange and global perspectives.",
                    "Culture",
                    "How can we celebrate differences while finding common ground?",
                    "What role does travel play in cultural understanding?",
                    "How can we combat cultural stereotypes and biases?"),
            topic("Entrepreneurship and Innovation",
                    "What drives innovation and successful business creation?",
                    "Business",
                    "What qualities make a successful entrepreneur?",
                    "How can failure contribute to eventual success?",
                    "What role does risk-taking play in innovation?"),
            topic("Personal Growth and Self-Development",
                    "Strategies for continuous learning and personal improvement.",
                    "Personal Development",
                    "What habits contribute most to personal growth?",
                    "How can we overcome limiting beliefs?",
                    "What role does feedback play in self-improvement?")
    );

    private static Topic topic(String title, String description, String category, String... questions) {
        return new Topic(title, description, category, List.of(questions), SOURCE);
    }

    public static List<Topic> all() {
        return TOPICS;
    }

    public static Topic random() {
        return TOPICS.get(ThreadLocalRandom.current().nextInt(TOPICS.size()));
    }

    /** Case-insensitive category lookup. */
    public static Optional<Topic> byCategory(String category) {
        if (category == null || category.isBlank()) return Optional.empty();
        String c = category.trim().toLowerCase(Locale.ROOT);
        for (Topic t : TOPICS) {
            if (t.category().toLowerCase(Locale.ROOT).equals(c)) return Optional.of(t);
        }
        return Optional.empty();
    }
}

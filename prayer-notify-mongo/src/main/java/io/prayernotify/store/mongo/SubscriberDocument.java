package io.prayernotify.store.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.ArrayList;
import java.util.List;

@Document(collection = "subscribers")
public class SubscriberDocument {

    @Id
    private String id;

    private String pushToken;
    private List<String> followingVenueIds = new ArrayList<>();

    public SubscriberDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getPushToken() {
        return pushToken;
    }

    public void setPushToken(String pushToken) {
        this.pushToken = pushToken;
    }

    public List<String> getFollowingVenueIds() {
        return followingVenueIds;
    }

    public void setFollowingVenueIds(List<String> followingVenueIds) {
        this.followingVenueIds = followingVenueIds;
    }
}

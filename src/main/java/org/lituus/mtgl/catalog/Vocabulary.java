package org.lituus.mtgl.catalog;

import java.util.List;
import java.util.Map;

/**
 * Bundled rules vocabulary, grouped the way the comprehensive rules group it.
 * Section numbers refer to the comprehensive rules.
 */
public final class Vocabulary {
    private Vocabulary() {}

    public static final String VERSION = "1.0";

    // 701.2 - 701.43
    public static final List<String> KEYWORD_ACTIONS = List.of(
        "activate", "unattach", "attach", "cast", "counter", "create", "destroy", "discard",
        "double", "exchange", "exile", "fight", "play", "regenerate", "reveal", "sacrifice",
        "scry", "search", "shuffle", "tap", "untap", "fateseal", "clash", "abandon",
        "proliferate", "transform", "detain", "populate", "monstrosity", "vote", "bolster",
        "manifest", "support", "investigate", "meld", "goad", "exert", "explore", "surveil",
        "adapt", "amass");

    // frequent verbs that are not keyword actions
    public static final List<String> ACTIONS = List.of(
        "put", "remove", "distribute", "get", "return", "draw", "move", "copy", "look", "pay",
        "deal", "gain", "lose", "attack", "block", "add", "enter", "leave", "choose", "die",
        "spend", "take", "skip", "cycle", "reduce", "trigger", "prevent", "declare",
        "has", "have", "switch", "phase in", "phase out", "flip", "assign", "win", "control",
        "own", "become", "count", "mill");

    // 702.2 - 702.136
    public static final List<String> KEYWORDS = List.of(
        "deathtouch", "defender", "double strike", "enchant", "equip", "first strike", "flash",
        "flying", "haste", "hexproof", "indestructible", "intimidate", "landwalk", "lifelink",
        "protection", "reach", "shroud", "trample", "vigilance", "banding", "rampage",
        "cumulative upkeep", "flanking", "phasing", "buyback", "shadow", "cycling", "echo",
        "horsemanship", "fading", "kicker", "multikicker", "flashback", "madness", "fear",
        "morph", "megamorph", "amplify", "provoke", "storm", "affinity", "entwine", "modular",
        "sunburst", "bushido", "soulshift", "splice", "offering", "ninjutsu", "commander ninjutsu",
        "epic", "convoke", "dredge", "transmute", "bloodthirst", "haunt", "replicate", "forecast",
        "graft", "recover", "ripple", "split second", "suspend", "vanishing", "absorb",
        "aura swap", "delve", "fortify", "frenzy", "gravestorm", "poisonous", "transfigure",
        "champion", "changeling", "evoke", "hideaway", "prowl", "reinforce", "conspire",
        "persist", "wither", "retrace", "devour", "exalted", "unearth", "cascade", "annihilator",
        "level up", "rebound", "totem armor", "infect", "battle cry", "living weapon",
        "undying", "miracle", "soulbond", "overload", "scavenge", "unleash", "cipher",
        "evolve", "extort", "fuse", "bestow", "tribute", "dethrone", "outlast", "prowess",
        "dash", "exploit", "menace", "renown", "awaken", "devoid", "ingest", "myriad", "surge",
        "skulk", "emerge", "escalate", "melee", "crew", "fabricate", "partner with", "partner",
        "undaunted", "improvise", "aftermath", "embalm", "eternalize", "afflict", "ascend",
        "assist", "jump-start", "mentor", "afterlife", "riot", "spectacle", "ward",
        "islandwalk", "swampwalk", "forestwalk", "mountainwalk", "plainswalk");

    // 207.2c
    public static final List<String> ABILITY_WORDS = List.of(
        "addendum", "battalion", "bloodrush", "channel", "chroma", "cohort", "constellation",
        "converge", "council's dilemma", "delirium", "domain", "eminence", "enrage",
        "fateful hour", "ferocious", "formidable", "grandeur", "hellbent", "heroic", "imprint",
        "inspired", "join forces", "kinship", "landfall", "lieutenant", "metalcraft", "morbid",
        "parley", "radiance", "raid", "rally", "revolt", "spell mastery", "strive", "sweep",
        "tempting offer", "threshold", "will of the council");

    // 4
    public static final List<String> ZONES = List.of(
        "library", "hand", "battlefield", "graveyard", "stack", "exile", "command", "anywhere");

    // 109
    public static final List<String> OBJECTS = List.of(
        "ability", "card", "copy", "token", "spell", "permanent", "emblem", "source",
        "city's blessing", "game", "mana pool", "commander", "mana", "attacker", "blocker",
        "it", "them", "coin", "counter");

    // 610.1
    public static final List<String> EFFECTS = List.of("damage", "combat damage", "noncombat damage");

    public static final List<String> PLAYERS = List.of(
        "you", "opponent", "teammate", "player", "owner", "controller", "their", "they");

    public static final List<String> SELF_REFERENCES = List.of(
        "~", "this creature", "this spell", "this permanent", "this card", "this artifact",
        "this enchantment", "this land", "this planeswalker", "this token", "this equipment",
        "this aura", "this vehicle", "this saga");

    // 109.3
    public static final List<String> META_CHARACTERISTICS = List.of(
        "p/t", "everything", "text", "name", "mana cost", "converted mana cost", "mana value",
        "power", "toughness", "color identity", "color", "type");

    public static final List<String> COLORS = List.of(
        "white", "blue", "black", "green", "red", "colorless", "multicolored", "monocolored");

    public static final List<String> SUPERTYPES = List.of(
        "legendary", "basic", "snow", "world", "tribal");

    public static final List<String> CARD_TYPES = List.of(
        "instant", "creature", "sorcery", "planeswalker", "enchantment", "land", "artifact", "historic");

    public static final List<String> SUBTYPES = List.of(
        "dryad", "wurm", "wall", "horse", "ogre", "shaman", "dragon", "zombie", "human",
        "warrior", "aura", "desert", "beast", "angel", "djinn", "soldier", "spirit", "rhino",
        "cleric", "treefolk", "centaur", "scarecrow", "rat", "drake", "knight", "goblin",
        "rogue", "bird", "monk", "gremlin", "elephant", "naga", "archer", "gargoyle", "lizard",
        "equipment", "golem", "myr", "elemental", "demon", "merfolk", "wizard", "phoenix",
        "snake", "elf", "druid", "insect", "advisor", "horror", "dwarf", "nomad", "crocodile",
        "construct", "cat", "giant", "imp", "spider", "mercenary", "shapeshifter", "pirate",
        "minotaur", "avatar", "scout", "skeleton", "berserker", "sliver", "frog", "kithkin",
        "swamp", "eldrazi", "kor", "arcane", "mountain", "vampire", "leviathan", "artificer",
        "curse", "ally", "assassin", "plains", "ooze", "specter", "fungus", "gnome", "hellion",
        "cyclops", "pilot", "gorgon", "vedalken", "ape", "samurai", "wolf", "minion", "kobold",
        "vehicle", "kavu", "serpent", "hound", "nightmare", "salamander", "orc", "werewolf",
        "plant", "troll", "fish", "dinosaur", "faerie", "shade", "griffin", "juggernaut",
        "elk", "devil", "boar", "aetherborn", "viashino", "barbarian", "rebel", "pegasus",
        "thopter", "satyr", "thrull", "worm", "illusion", "yeti", "homunculus", "drone",
        "sphinx", "trap", "saga", "nymph", "kirin", "bear", "weird", "incarnation", "pest",
        "hydra", "gate", "turtle", "siren", "god", "chimera", "squirrel", "kraken", "ninja",
        "moonfolk", "archon", "processor", "shrine", "praetor", "efreet", "island", "elder",
        "forest", "bat", "fox", "sheep", "hyena", "unicorn", "slug", "squid", "harpy",
        "octopus", "mystic", "whale", "basilisk", "assembly-worker", "jellyfish", "monkey",
        "goat", "leech", "starfish", "ferret", "rabbit", "cockatrice", "reflection", "spawn",
        "fortification", "army", "clue", "germ", "saproling", "scion", "servo", "treasure",
        "food", "gold");

    // 110.6 and frequent status words
    public static final List<String> STATUSES = List.of(
        "tapped", "untapped", "flipped", "unflipped", "face up", "face-up", "face down",
        "face-down", "phased in", "phased out", "attacking", "blocking", "blocked", "defending",
        "transformed", "enchanted", "equipped", "exiled", "attached", "activated", "triggered",
        "revealed");

    // characteristics that apply to players
    public static final List<String> PLAYER_CHARACTERISTICS = List.of(
        "life total", "life", "cost", "hand size", "devotion");

    // 500 - 514
    public static final Map<String, String> PHASES = Map.ofEntries(
        Map.entry("untap step", "untap step"),
        Map.entry("upkeep", "upkeep"),
        Map.entry("upkeep step", "upkeep"),
        Map.entry("draw step", "draw step"),
        Map.entry("main phase", "main phase"),
        Map.entry("precombat main phase", "precombat main phase"),
        Map.entry("postcombat main phase", "postcombat main phase"),
        Map.entry("combat", "combat"),
        Map.entry("combat phase", "combat"),
        Map.entry("beginning of combat", "beginning of combat"),
        Map.entry("beginning of combat step", "beginning of combat"),
        Map.entry("declare attackers step", "declare attackers step"),
        Map.entry("declare blockers step", "declare blockers step"),
        Map.entry("combat damage step", "combat damage step"),
        Map.entry("end of combat", "end of combat"),
        Map.entry("end of combat step", "end of combat"),
        Map.entry("end step", "end step"),
        Map.entry("cleanup step", "cleanup step"),
        Map.entry("end of turn", "eot"),
        Map.entry("turn", "turn"),
        Map.entry("phase", "phase"),
        Map.entry("step", "step"));

    // counters other than p/t counters
    public static final List<String> NAMED_COUNTERS = List.of(
        "age", "aim", "arrow", "arrowhead", "awakening", "blaze", "blood", "bounty", "bribery",
        "brick", "carrion", "charge", "credit", "corpse", "crystal", "cube", "currency", "death",
        "delay", "depletion", "despair", "devotion", "divinity", "doom", "dream", "echo", "egg",
        "elixir", "energy", "eon", "experience", "eyeball", "fade", "fate", "feather", "filibuster",
        "flood", "fungus", "fuse", "gem", "glyph", "gold", "growth", "hatchling", "healing", "hit",
        "hoofprint", "hour", "hourglass", "hunger", "ice", "incubation", "infection", "intervention",
        "isolation", "javelin", "ki", "level", "lore", "loyalty", "luck", "magnet", "manifestation",
        "mannequin", "mask", "matrix", "mine", "mining", "mire", "music", "muster", "net", "omen",
        "ore", "page", "pain", "paralyzation", "petal", "petrification", "phylactery", "pin",
        "plague", "poison", "polyp", "pressure", "prey", "pupa", "quest", "rust", "scream", "shell",
        "shield", "silver", "shred", "sleep", "sleight", "slime", "slumber", "soot", "spore",
        "storage", "strife", "study", "theft", "tide", "time", "tower", "training", "trap",
        "treasure", "velocity", "verse", "vitality", "volatile", "wage", "winch", "wind", "wish");

    public static final List<String> QUANTIFIERS = List.of(
        "a", "target", "each", "all", "any", "every", "another", "other", "this", "that",
        "those", "these", "first", "second", "third", "fourth", "fifth", "sixth", "seventh",
        "eighth", "ninth", "tenth", "the", "additional", "single");

    public static final List<String> PREPOSITIONS = List.of(
        "on top of", "up to", "on bottom of", "from", "to", "into", "in", "on", "under", "onto",
        "top of", "top", "bottom of", "bottom", "without", "with", "for", "of", "by", "among");

    public static final List<String> CONDITIONALS = List.of(
        "only if", "if", "would", "unless", "rather than", "instead", "may", "except", "not",
        "only", "cannot", "instead of");

    public static final List<String> SEQUENCES = List.of(
        "before", "next", "after", "until", "begin", "beginning", "end", "ending", "then",
        "during", "as long as", "as", "this turn", "each turn");

    public static final Map<String, String> OPERATORS = Map.ofEntries(
        Map.entry("less than or equal to", "<="),
        Map.entry("greater than or equal to", ">="),
        Map.entry("less than", "<"),
        Map.entry("greater than", ">"),
        Map.entry("equal to", "="),
        Map.entry("or less", "<="),
        Map.entry("or greater", ">="),
        Map.entry("or more", ">="),
        Map.entry("plus", "+"),
        Map.entry("minus", "-"),
        Map.entry("and/or", "and/or"),
        Map.entry("and", "and"),
        Map.entry("or", "or"));

    public static final List<String> TRIGGERS = List.of("at", "when", "whenever");

    // saga chapters
    public static final Map<String, String> ROMAN_NUMERALS = Map.of(
        "i", "1", "ii", "2", "iii", "3", "iv", "4", "v", "5", "vi", "6");
}
